package com.datafetch.domain.service;

import java.util.UUID;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(UUID jobId) {
        super("Job " + jobId + " not found");
    }
}
