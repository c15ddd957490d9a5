package com.datafetch.domain.pool;

import com.datafetch.config.FetchProperties;
import com.datafetch.domain.model.SizingPlan;
import com.datafetch.domain.model.WorkerSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Derives worker-pool bounds and per-worker resources from a request's total estimated size.
 *
 * max workers = ceil(total GB / worker memory limit), min workers = ceil(max / 10), both at
 * least 1. Workers request half of the configured memory and CPU limits, and half of that
 * again when the whole request fits into a single worker.
 */
@Component
@RequiredArgsConstructor
public class SizingEstimator {

    static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    private final FetchProperties properties;

    /**
     * Requests at or below the threshold run on the shared path without a pool of their own.
     */
    public boolean requiresElasticPool(long totalBytes) {
        return toGb(totalBytes) > properties.getDataThresholdGb();
    }

    public SizingPlan plan(long totalBytes) {
        double totalGb = toGb(Math.max(0, totalBytes));
        double memoryLimit = properties.getWorkerMemoryLimitGb();
        double cpuLimit = properties.getWorkerCpuLimit();

        int maxWorkers = Math.max(1, (int) Math.ceil(totalGb / memoryLimit));
        int minWorkers = Math.max(1, (int) Math.ceil(maxWorkers / 10d));

        double memoryRequest = memoryLimit / 2;
        double cpuRequest = cpuLimit / 2;
        if (totalGb < memoryLimit) {
            memoryRequest = memoryRequest / 2;
            cpuRequest = cpuRequest / 2;
        }

        WorkerSpec workerSpec = WorkerSpec.builder()
                .image(WorkerImage.parse(properties.getWorkerImage()).toReference())
                .memoryLimitGb(memoryLimit)
                .memoryRequestGb(memoryRequest)
                .cpuLimit(cpuLimit)
                .cpuRequest(cpuRequest)
                .threadsPerWorker(properties.getWorkerThreads())
                .build();

        return SizingPlan.builder()
                .minWorkers(minWorkers)
                .maxWorkers(maxWorkers)
                .workerSpec(workerSpec)
                .totalBytes(totalBytes)
                .build();
    }

    static double toGb(long bytes) {
        return bytes / BYTES_PER_GB;
    }
}
