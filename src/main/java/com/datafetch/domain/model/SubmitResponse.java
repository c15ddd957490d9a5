package com.datafetch.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitResponse {

    private String status;
    private UUID jobUuid;

    /**
     * Polling URL of the job.
     */
    private String resultUrl;

    private String msg;
}
