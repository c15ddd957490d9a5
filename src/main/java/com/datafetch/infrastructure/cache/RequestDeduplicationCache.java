package com.datafetch.infrastructure.cache;

import com.datafetch.config.FetchProperties;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Maps request fingerprints to the job that serves them.
 *
 * A miss first persists the job under a fresh id and only then publishes
 * {@code fingerprint -> id} with one SET NX EX call. A pointer therefore never names a job that
 * does not exist yet. Among racing callers exactly one publish succeeds; the others discard the
 * job they created before it was ever visible and return the winner's id. Entries expire after
 * {@link FetchProperties#getDedupTtl()}, which is shorter than the job retention, so a live
 * pointer always resolves to a job.
 *
 * Failure Handling:
 * - Job creation failure publishes nothing and rethrows
 * - Redis down or circuit open: the job is created without deduplication
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RequestDeduplicationCache {

    static final String KEY_PREFIX = "fetch:request:";
    static final int MAX_ATTEMPTS = 3;

    private final StringRedisTemplate redisTemplate;
    private final FetchProperties properties;

    /**
     * Returns the job already registered for {@code fingerprint}. Otherwise creates a job with
     * {@code createJob}, publishes it and returns it. A created job that loses the publish race
     * is handed to {@code discardJob}.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "createWithoutDedup")
    public DedupReservation lookupOrCreate(String fingerprint,
                                           Consumer<UUID> createJob,
                                           Consumer<UUID> discardJob) {
        String key = KEY_PREFIX + fingerprint;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String existing = redisTemplate.opsForValue().get(key);
            if (existing != null) {
                log.debug("Dedup hit for {}: job {}", fingerprint, existing);
                return DedupReservation.existing(UUID.fromString(existing));
            }

            UUID candidate = UUID.randomUUID();
            createJob.accept(candidate);

            Boolean published;
            try {
                published = redisTemplate.opsForValue()
                        .setIfAbsent(key, candidate.toString(), properties.getDedupTtl());
            } catch (RuntimeException e) {
                discard(discardJob, candidate);
                throw e;
            }

            if (Boolean.TRUE.equals(published)) {
                log.debug("Dedup miss for {}, published job {}", fingerprint, candidate);
                return DedupReservation.created(candidate);
            }

            log.debug("Lost publish race for {}, discarding job {} (attempt {})", fingerprint, candidate, attempt);
            discard(discardJob, candidate);
        }
        throw new IllegalStateException("Could not publish or read dedup entry for " + fingerprint);
    }

    /**
     * Drops the pointer for {@code fingerprint} if it still names {@code jobId}.
     */
    @CircuitBreaker(name = "redis", fallbackMethod = "releaseFallback")
    public void release(String fingerprint, UUID jobId) {
        String key = KEY_PREFIX + fingerprint;
        if (jobId.toString().equals(redisTemplate.opsForValue().get(key))) {
            redisTemplate.delete(key);
            log.debug("Released dedup entry for {} (job {})", fingerprint, jobId);
        }
    }

    private void discard(Consumer<UUID> discardJob, UUID jobId) {
        try {
            discardJob.accept(jobId);
        } catch (RuntimeException e) {
            log.error("Could not discard unpublished job {}: {}", jobId, e.getMessage(), e);
        }
    }

    // Fallback methods (circuit breaker)

    DedupReservation createWithoutDedup(String fingerprint, Consumer<UUID> createJob, Consumer<UUID> discardJob,
                                        RedisConnectionFailureException e) {
        log.warn("Redis unavailable ({}), creating job without deduplication", e.getMessage());
        return createDirectly(createJob);
    }

    DedupReservation createWithoutDedup(String fingerprint, Consumer<UUID> createJob, Consumer<UUID> discardJob,
                                        CallNotPermittedException e) {
        log.warn("Redis circuit breaker open, creating job without deduplication");
        return createDirectly(createJob);
    }

    private void releaseFallback(String fingerprint, UUID jobId, Exception e) {
        log.warn("Redis circuit breaker open, dedup entry for {} left to expire", fingerprint);
    }

    private DedupReservation createDirectly(Consumer<UUID> createJob) {
        UUID jobId = UUID.randomUUID();
        createJob.accept(jobId);
        return DedupReservation.bypassed(jobId);
    }
}
