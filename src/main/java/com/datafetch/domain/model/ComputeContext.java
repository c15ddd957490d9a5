package com.datafetch.domain.model;

import lombok.Value;

import java.util.concurrent.Executor;

/**
 * Where a job's merge and render work runs: on a job's own elastic pool, or directly on the
 * job thread for requests below the provisioning threshold.
 */
@Value
public class ComputeContext {

    private static final ComputeContext DIRECT = new ComputeContext(Runnable::run, 1);

    Executor executor;

    /**
     * Number of tasks the executor can usefully run at once.
     */
    int parallelism;

    public static ComputeContext direct() {
        return DIRECT;
    }
}
