package com.datafetch.domain.model;

import lombok.Value;

import java.util.UUID;

@Value
public class SubmitResult {

    UUID jobId;

    /**
     * False when an identical request already had a job and its id was reused.
     */
    boolean created;
}
