package com.datafetch.domain.pool;

import com.datafetch.domain.model.ComputeContext;
import com.datafetch.domain.model.SizingPlan;
import com.datafetch.infrastructure.cluster.ProvisionedCluster;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Handle on the elastic pool acquired for one job. Owned by that job only and released
 * through {@link #close()}, which tears the pool down at most once.
 */
public class ElasticPool implements AutoCloseable {

    private final SizingPlan plan;
    private final Consumer<ElasticPool> releaser;
    private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.UNINITIALIZED);
    private volatile ProvisionedCluster cluster;

    ElasticPool(SizingPlan plan, Consumer<ElasticPool> releaser) {
        this.plan = plan;
        this.releaser = releaser;
    }

    public SizingPlan getPlan() {
        return plan;
    }

    public PoolState getState() {
        return state.get();
    }

    /**
     * Executor and parallelism for work that should run on this pool.
     */
    public ComputeContext computeContext() {
        if (state.get() != PoolState.ACTIVE) {
            throw new IllegalStateException("Pool is " + state.get() + ", not ACTIVE");
        }
        return new ComputeContext(cluster.executor(), Math.max(1, cluster.parallelism()));
    }

    @Override
    public void close() {
        releaser.accept(this);
    }

    ProvisionedCluster getCluster() {
        return cluster;
    }

    void attach(ProvisionedCluster cluster) {
        this.cluster = cluster;
    }

    boolean transition(PoolState expected, PoolState next) {
        return state.compareAndSet(expected, next);
    }

    /**
     * Moves the pool to CLOSED.
     *
     * @return false if it was already closed
     */
    boolean markClosed() {
        return state.getAndSet(PoolState.CLOSED) != PoolState.CLOSED;
    }
}
