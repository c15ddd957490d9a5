package com.datafetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Job status as returned to pollers, in either wire encoding.
 *
 * result is null unless the job succeeded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {

    private UUID jobUuid;
    private JobState state;
    private String msg;
    private List<String> progress;
    private FetchResult result;
    private Instant createdAt;
    private Instant completedAt;

    public static JobStatusResponse from(JobSnapshot snapshot) {
        return JobStatusResponse.builder()
                .jobUuid(snapshot.getJobId())
                .state(snapshot.getState())
                .msg(snapshot.getProgressMessage())
                .progress(snapshot.getProgress())
                .result(snapshot.getResult())
                .createdAt(snapshot.getCreatedAt())
                .completedAt(snapshot.getCompletedAt())
                .build();
    }
}
