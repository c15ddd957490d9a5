package com.datafetch.infrastructure.cache;

import com.datafetch.config.FetchProperties;
import com.datafetch.domain.model.CancelSignal;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Out-of-band cancellation flags, shared through Redis so that a signal reaches the job
 * whichever instance runs it. Flags expire with the job retention window.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobCancellationRegistry {

    static final String KEY_PREFIX = "fetch:cancel:";

    private final StringRedisTemplate redisTemplate;
    private final FetchProperties properties;

    @CircuitBreaker(name = "redis")
    public void signal(UUID jobId, CancelSignal signal) {
        redisTemplate.opsForValue().set(KEY_PREFIX + jobId, signal.name(), properties.getResultRetention());
        log.debug("Cancellation {} recorded for job {}", signal, jobId);
    }

    @CircuitBreaker(name = "redis", fallbackMethod = "noSignal")
    public Optional<CancelSignal> pendingSignal(UUID jobId) {
        String value = redisTemplate.opsForValue().get(KEY_PREFIX + jobId);
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(CancelSignal.valueOf(value));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown cancellation value '{}' for job {}", value, jobId);
            return Optional.empty();
        }
    }

    private Optional<CancelSignal> noSignal(UUID jobId, Exception e) {
        log.warn("Redis unavailable, treating job {} as not cancelled: {}", jobId, e.getMessage());
        return Optional.empty();
    }
}
