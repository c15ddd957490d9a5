package com.datafetch.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Worker-pool bounds and per-worker resources derived from a request's estimated size.
 * Always {@code 1 <= minWorkers <= maxWorkers}.
 */
@Value
@Builder
public class SizingPlan {

    int minWorkers;
    int maxWorkers;
    WorkerSpec workerSpec;

    long totalBytes;
}
