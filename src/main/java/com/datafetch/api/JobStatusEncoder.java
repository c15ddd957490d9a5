package com.datafetch.api;

import com.datafetch.config.FetchProperties;
import com.datafetch.domain.model.JobStatusResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.StringUtils;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Picks the wire encoding of a job status by API version: the current version answers with
 * JSON, the packed version with MessagePack. Both carry the same fields.
 */
@Component
public class JobStatusEncoder {

    public static final MediaType MSGPACK = MediaType.parseMediaType("application/x-msgpack");

    private final FetchProperties properties;
    private final ObjectMapper packedMapper;

    public JobStatusEncoder(FetchProperties properties) {
        this.properties = properties;
        this.packedMapper = new ObjectMapper(new MessagePackFactory())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * @throws UnsupportedApiVersionException for any version other than the current or packed one
     */
    public String requireSupported(String version) {
        String resolved = StringUtils.defaultIfBlank(version, properties.getCurrentApiVersion());
        if (!resolved.equals(properties.getCurrentApiVersion()) && !resolved.equals(properties.getPackedApiVersion())) {
            throw new UnsupportedApiVersionException(resolved,
                    properties.getCurrentApiVersion(), properties.getPackedApiVersion());
        }
        return resolved;
    }

    public ResponseEntity<?> encode(JobStatusResponse status, String version) {
        String resolved = requireSupported(version);
        if (resolved.equals(properties.getCurrentApiVersion())) {
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(status);
        }
        return ResponseEntity.ok()
                .contentType(MSGPACK)
                .body(pack(status));
    }

    byte[] pack(JobStatusResponse status) {
        try {
            return packedMapper.writeValueAsBytes(status);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode status of job " + status.getJobUuid(), e);
        }
    }

    ObjectMapper getPackedMapper() {
        return packedMapper;
    }
}
