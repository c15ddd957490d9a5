package com.datafetch.infrastructure.persistence.entity;

import com.datafetch.domain.model.JobState;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Persistent fetch job.
 *
 * Owns the job state machine: PENDING -> RUNNING -> SUCCEEDED | FAILED | CANCELLED, with
 * PENDING -> FAILED | CANCELLED for jobs that never started. Every message is appended to
 * the progress log in emission order and becomes the current progress message.
 */
@Entity
@Table(name = "fetch_jobs", indexes = {
    @Index(name = "idx_fetch_jobs_state", columnList = "state"),
    @Index(name = "idx_fetch_jobs_completed_at", columnList = "completedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchJobEntity {

    public static final int MAX_MESSAGE_LENGTH = 1000;

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String requestJson;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobState state = JobState.PENDING;

    @Column(length = MAX_MESSAGE_LENGTH)
    private String progressMessage;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "fetch_job_progress", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "seq")
    @Column(name = "message", length = MAX_MESSAGE_LENGTH)
    @Builder.Default
    private List<String> progressLog = new ArrayList<>();

    @Column(columnDefinition = "TEXT")
    private String result;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant completedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markStarted() {
        moveTo(JobState.RUNNING);
        this.startedAt = Instant.now();
    }

    public void recordProgress(String message) {
        if (state != JobState.RUNNING) {
            throw new IllegalStateException("Job " + jobId + " is " + state + ", progress requires RUNNING");
        }
        append(message);
    }

    public void markSucceeded(String resultJson, String message) {
        moveTo(JobState.SUCCEEDED);
        this.result = resultJson;
        finish(message);
    }

    public void markFailed(String message) {
        moveTo(JobState.FAILED);
        this.result = null;
        finish(message);
    }

    public void markCancelled(String message) {
        moveTo(JobState.CANCELLED);
        this.result = null;
        finish(message);
    }

    public long getExecutionTimeMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return completedAt.toEpochMilli() - startedAt.toEpochMilli();
    }

    private void moveTo(JobState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + jobId + " cannot move from " + state + " to " + next);
        }
        this.state = next;
    }

    private void finish(String message) {
        append(message);
        this.completedAt = Instant.now();
    }

    private void append(String message) {
        String text = StringUtils.abbreviate(Objects.toString(message, ""), MAX_MESSAGE_LENGTH);
        this.progressMessage = text;
        this.progressLog.add(text);
    }
}
