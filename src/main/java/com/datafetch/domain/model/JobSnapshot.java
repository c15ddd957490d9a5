package com.datafetch.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable view of a job handed to pollers.
 */
@Value
@Builder
public class JobSnapshot {

    UUID jobId;
    JobState state;
    String progressMessage;
    List<String> progress;
    FetchResult result;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;
}
