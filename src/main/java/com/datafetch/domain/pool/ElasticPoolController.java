package com.datafetch.domain.pool;

import com.datafetch.config.FetchProperties;
import com.datafetch.domain.model.SizingPlan;
import com.datafetch.infrastructure.cluster.ClusterProvisioner;
import com.datafetch.infrastructure.cluster.ProvisionedCluster;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Acquires and releases the elastic worker pool of a job.
 *
 * Lifecycle: UNINITIALIZED -> SCALING -> ACTIVE -> CLOSED. Provisioning is delegated to the
 * {@link ClusterProvisioner}; this controller supplies the worker spec and the adapt bounds
 * and waits until the minimum number of workers is up.
 *
 * Failure handling:
 * - Provisioning or readiness failures tear down whatever was created and raise
 *   {@link PoolProvisioningException}. No retry.
 * - Teardown failures are logged and never rethrown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ElasticPoolController {

    private final ClusterProvisioner provisioner;
    private final FetchProperties properties;
    private final MeterRegistry meterRegistry;

    public ElasticPool acquire(SizingPlan plan) {
        ElasticPool pool = new ElasticPool(plan, this::release);
        pool.transition(PoolState.UNINITIALIZED, PoolState.SCALING);

        try {
            ProvisionedCluster cluster = provisioner.provision(plan.getWorkerSpec(), plan.getMinWorkers());
            pool.attach(cluster);
            cluster.adapt(plan.getMinWorkers(), plan.getMaxWorkers());

            if (!cluster.awaitWorkers(plan.getMinWorkers(), properties.getPoolReadyTimeout())) {
                throw new PoolProvisioningException("Cluster did not reach " + plan.getMinWorkers()
                        + " worker(s) within " + properties.getPoolReadyTimeout());
            }
            if (!pool.transition(PoolState.SCALING, PoolState.ACTIVE)) {
                throw new PoolProvisioningException("Pool was closed while scaling");
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(pool);
            countPool("failed");
            throw new PoolProvisioningException("Interrupted while waiting for workers", e);

        } catch (PoolProvisioningException e) {
            release(pool);
            countPool("failed");
            throw e;

        } catch (RuntimeException e) {
            release(pool);
            countPool("failed");
            throw new PoolProvisioningException("Cluster provisioning failed: " + e.getMessage(), e);
        }

        countPool("acquired");
        log.info("Elastic pool active: {}-{} workers, image {}",
                plan.getMinWorkers(), plan.getMaxWorkers(), plan.getWorkerSpec().getImage());
        return pool;
    }

    /**
     * Tears the pool down. Safe to call repeatedly; only the first call has an effect.
     */
    public void release(ElasticPool pool) {
        if (!pool.markClosed()) {
            return;
        }
        ProvisionedCluster cluster = pool.getCluster();
        if (cluster == null) {
            return;
        }
        try {
            cluster.close();
            countPool("released");
            log.info("Elastic pool released ({}-{} workers)",
                    pool.getPlan().getMinWorkers(), pool.getPlan().getMaxWorkers());
        } catch (Exception e) {
            log.warn("Error tearing down elastic pool: {}", e.getMessage(), e);
        }
    }

    private void countPool(String event) {
        Counter.builder("fetch.pool")
                .tag("event", event)
                .register(meterRegistry)
                .increment();
    }
}
