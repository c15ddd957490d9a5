package com.datafetch.domain.service;

import com.datafetch.domain.model.AxisMapping;
import com.datafetch.domain.model.FetchRequest;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

/**
 * Order-independent digest of a fetch request, used as its deduplication key.
 * Dataset ids are sorted and de-duplicated; axis names are trimmed.
 */
@Service
public class FingerprintService {

    private static final Charset HASHING_CHARSET = StandardCharsets.UTF_8;

    private final HashFunction hashFunction = Hashing.sha256();

    public String fingerprint(FetchRequest request) {
        Hasher hasher = hashFunction.newHasher();

        List<String> refs = request.getRefs() == null ? List.of() : request.getRefs();
        TreeSet<String> sortedRefs = new TreeSet<>();
        refs.forEach(ref -> sortedRefs.add(StringUtils.trimToEmpty(ref)));
        hasher.putInt(sortedRefs.size());
        sortedRefs.forEach(ref -> putField(hasher, ref));

        AxisMapping axis = request.getAxis() == null ? new AxisMapping() : request.getAxis();
        putField(hasher, axis.getX());
        putField(hasher, axis.getY());
        putField(hasher, axis.getZ());
        putField(hasher, axis.getColor());

        putInstant(hasher, request.getStartDt());
        putInstant(hasher, request.getEndDt());

        return hasher.hash().toString();
    }

    private static void putField(Hasher hasher, String value) {
        String text = StringUtils.trimToEmpty(value);
        hasher.putInt(text.length()).putString(text, HASHING_CHARSET);
    }

    private static void putInstant(Hasher hasher, Instant instant) {
        if (instant == null) {
            hasher.putBoolean(false);
            return;
        }
        hasher.putBoolean(true).putLong(instant.getEpochSecond()).putInt(instant.getNano());
    }
}
