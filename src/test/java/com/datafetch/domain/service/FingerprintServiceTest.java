package com.datafetch.domain.service;

import com.datafetch.domain.model.AxisMapping;
import com.datafetch.domain.model.FetchRequest;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FingerprintServiceTest {

    private final FingerprintService service = new FingerprintService();

    private static FetchRequest request(List<String> refs, String y, Instant end) {
        return FetchRequest.builder()
                .refs(refs)
                .axis(AxisMapping.builder().x("time").y(y).z("").color("").build())
                .startDt(Instant.parse("2020-01-01T00:00:00Z"))
                .endDt(end)
                .build();
    }

    @Test
    void testRefOrderDoesNotMatter() {
        Instant end = Instant.parse("2020-01-02T00:00:00Z");

        String first = service.fingerprint(request(List.of("a", "b", "c"), "temperature", end));
        String second = service.fingerprint(request(List.of("c", "a", "b"), "temperature", end));
        String duplicated = service.fingerprint(request(List.of("b", "c", "a", "a"), "temperature", end));

        assertEquals(first, second);
        assertEquals(first, duplicated);
        assertEquals(64, first.length());
    }

    @Test
    void testDifferentFieldsDiffer() {
        Instant end = Instant.parse("2020-01-02T00:00:00Z");
        String base = service.fingerprint(request(List.of("a", "b"), "temperature", end));

        assertNotEquals(base, service.fingerprint(request(List.of("a", "b"), "salinity", end)));
        assertNotEquals(base, service.fingerprint(request(List.of("a", "b"), "temperature", end.plusSeconds(1))));
        assertNotEquals(base, service.fingerprint(request(List.of("a"), "temperature", end)));
    }

    @Test
    void testFieldBoundariesAreUnambiguous() {
        Instant end = Instant.parse("2020-01-02T00:00:00Z");

        assertNotEquals(service.fingerprint(request(List.of("ab", "c"), "temperature", end)),
                service.fingerprint(request(List.of("a", "bc"), "temperature", end)));
    }

    @Test
    void testAxisWhitespaceIgnored() {
        Instant end = Instant.parse("2020-01-02T00:00:00Z");

        assertEquals(service.fingerprint(request(List.of("a"), "temperature", end)),
                service.fingerprint(request(List.of("a"), " temperature ", end)));
    }
}
