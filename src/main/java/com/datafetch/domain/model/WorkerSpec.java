package com.datafetch.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-worker resource specification handed to the cluster provisioner.
 */
@Value
@Builder
public class WorkerSpec {

    String image;
    double memoryLimitGb;
    double memoryRequestGb;
    double cpuLimit;
    double cpuRequest;
    int threadsPerWorker;
}
