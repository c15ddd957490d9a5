package com.datafetch.domain.service;

import com.datafetch.infrastructure.cache.JobCancellationRegistry;

import java.util.UUID;

/**
 * Cooperative cancellation check for one job, polled between steps.
 */
public class CancellationToken {

    private final UUID jobId;
    private final JobCancellationRegistry registry;

    public CancellationToken(UUID jobId, JobCancellationRegistry registry) {
        this.jobId = jobId;
        this.registry = registry;
    }

    /**
     * @throws JobCancelledException if a signal is pending for the job
     */
    public void checkpoint() {
        registry.pendingSignal(jobId).ifPresent(signal -> {
            throw new JobCancelledException(signal);
        });
    }
}
