package com.datafetch.domain.service;

import com.datafetch.config.FetchProperties;
import com.datafetch.domain.model.FetchRequest;
import com.datafetch.domain.model.FetchResult;
import com.datafetch.domain.model.JobSnapshot;
import com.datafetch.domain.model.JobState;
import com.datafetch.infrastructure.persistence.entity.FetchJobEntity;
import com.datafetch.infrastructure.persistence.repository.FetchJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Job records: creation, single-writer progress handles, read-only snapshots for pollers and
 * purging of expired terminal jobs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FetchJobService {

    private static final EnumSet<JobState> TERMINAL =
            EnumSet.of(JobState.SUCCEEDED, JobState.FAILED, JobState.CANCELLED);

    private final FetchJobRepository repository;
    private final ObjectMapper objectMapper;
    private final FetchProperties properties;

    @Transactional
    public void create(UUID jobId, String fingerprint, FetchRequest request) {
        String requestJson;
        try {
            requestJson = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request cannot be serialized", e);
        }

        String message = "Job " + jobId + " created.";
        FetchJobEntity job = FetchJobEntity.builder()
                .jobId(jobId)
                .fingerprint(fingerprint)
                .requestJson(requestJson)
                .progressMessage(message)
                .progressLog(new ArrayList<>(List.of(message)))
                .createdAt(Instant.now())
                .build();
        repository.save(job);
        log.info("Job {} created for fingerprint {}", jobId, fingerprint);
    }

    /**
     * Deletes a job that was created but never published or dispatched.
     */
    @Transactional
    public void discard(UUID jobId) {
        repository.deleteById(jobId);
        log.debug("Discarded unpublished job {}", jobId);
    }

    public JobProgress open(UUID jobId) {
        FetchJobEntity job = repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return new JobProgress(job, repository, objectMapper);
    }

    /**
     * Fails a job that was created but could not be scheduled.
     */
    public void reject(UUID jobId, String message) {
        open(jobId).fail(message);
    }

    @Transactional(readOnly = true)
    public JobSnapshot snapshot(UUID jobId) {
        FetchJobEntity job = repository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return JobSnapshot.builder()
                .jobId(job.getJobId())
                .state(job.getState())
                .progressMessage(job.getProgressMessage())
                .progress(List.copyOf(job.getProgressLog()))
                .result(readResult(job))
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }

    @Scheduled(fixedDelayString = "${app.fetch.purge-interval:PT5M}")
    public void purgeExpired() {
        purgeCompletedBefore(Instant.now().minus(properties.getResultRetention()));
    }

    /**
     * Deletes terminal jobs completed before {@code cutoff}.
     */
    @Transactional
    public long purgeCompletedBefore(Instant cutoff) {
        long purged = repository.deleteByStateInAndCompletedAtBefore(TERMINAL, cutoff);
        if (purged > 0) {
            log.info("Purged {} job(s) completed before {}", purged, cutoff);
        }
        return purged;
    }

    private FetchResult readResult(FetchJobEntity job) {
        if (job.getResult() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(job.getResult(), FetchResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored result of job " + job.getJobId() + " is unreadable", e);
        }
    }
}
