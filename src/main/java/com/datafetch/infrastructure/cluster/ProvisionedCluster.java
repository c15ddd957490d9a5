package com.datafetch.infrastructure.cluster;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * A provisioned pool of workers whose size the provisioner adjusts between bounds.
 */
public interface ProvisionedCluster extends AutoCloseable {

    /**
     * Lets the provisioner scale the pool between {@code minimum} and {@code maximum} workers
     * based on load.
     */
    void adapt(int minimum, int maximum);

    /**
     * Blocks until at least {@code workers} workers are running or the timeout elapses.
     *
     * @return true when the workers are ready
     */
    boolean awaitWorkers(int workers, Duration timeout) throws InterruptedException;

    Executor executor();

    /**
     * Tasks the pool can run concurrently at its current maximum size.
     */
    int parallelism();

    @Override
    void close();
}
