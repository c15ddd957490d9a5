package com.datafetch.infrastructure.cache;

import com.datafetch.config.FetchProperties;
import com.datafetch.domain.model.CancelSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobCancellationRegistryTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private JobCancellationRegistry registry;
    private final UUID jobId = UUID.fromString("2b7e1f0c-8a55-4c8e-9a36-5b1f3d9e7a10");

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        registry = new JobCancellationRegistry(redisTemplate, new FetchProperties());
    }

    @Test
    void testSignalStoredWithRetentionTtl() {
        registry.signal(jobId, CancelSignal.SIGTERM);

        verify(valueOperations).set("fetch:cancel:" + jobId, "SIGTERM", Duration.ofDays(1));
    }

    @Test
    void testPendingSignal() {
        when(valueOperations.get("fetch:cancel:" + jobId)).thenReturn("SIGKILL");

        assertEquals(Optional.of(CancelSignal.SIGKILL), registry.pendingSignal(jobId));
    }

    @Test
    void testNoSignal() {
        when(valueOperations.get("fetch:cancel:" + jobId)).thenReturn(null);

        assertTrue(registry.pendingSignal(jobId).isEmpty());
    }

    @Test
    void testGarbageValueIgnored() {
        when(valueOperations.get("fetch:cancel:" + jobId)).thenReturn("SIGHUP");

        assertTrue(registry.pendingSignal(jobId).isEmpty());
    }
}
