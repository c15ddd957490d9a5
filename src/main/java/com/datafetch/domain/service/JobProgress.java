package com.datafetch.domain.service;

import com.datafetch.domain.model.FetchResult;
import com.datafetch.domain.model.JobState;
import com.datafetch.infrastructure.persistence.entity.FetchJobEntity;
import com.datafetch.infrastructure.persistence.repository.FetchJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.UUID;

/**
 * Write handle on one job, held by the thread executing it. Each call persists immediately so
 * pollers see progress in emission order.
 */
@Slf4j
public class JobProgress {

    private final FetchJobRepository repository;
    private final ObjectMapper objectMapper;
    private FetchJobEntity job;

    JobProgress(FetchJobEntity job, FetchJobRepository repository, ObjectMapper objectMapper) {
        this.job = job;
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    public UUID getJobId() {
        return job.getJobId();
    }

    public JobState getState() {
        return job.getState();
    }

    public void start() {
        job.markStarted();
        save();
        log.info("Job {} started", job.getJobId());
    }

    public void report(String message) {
        job.recordProgress(message);
        save();
        log.debug("Job {}: {}", job.getJobId(), message);
    }

    public void succeed(FetchResult result, String message) {
        String resultJson;
        try {
            resultJson = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize result of job " + job.getJobId(), e);
        }
        job.markSucceeded(resultJson, message);
        save();
        log.info("Job {} succeeded ({} ms)", job.getJobId(), job.getExecutionTimeMs());
    }

    public void fail(String message) {
        job.markFailed(message);
        save();
        log.info("Job {} failed: {}", job.getJobId(), message);
    }

    public void cancel(String message) {
        job.markCancelled(message);
        save();
        log.info("Job {} cancelled: {}", job.getJobId(), message);
    }

    private void save() {
        job = repository.save(job);
    }
}
