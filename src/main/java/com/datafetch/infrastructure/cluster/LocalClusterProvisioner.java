package com.datafetch.infrastructure.cluster;

import com.datafetch.domain.model.WorkerSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provisions workers as threads of a private, elastic thread pool.
 *
 * Each worker contributes {@link WorkerSpec#getThreadsPerWorker()} threads. The pool keeps the
 * adapted minimum alive, grows towards the maximum while tasks are waiting, and lets idle threads
 * above the minimum expire. When every thread is busy the submitting thread runs the task itself.
 */
@Slf4j
@Component
public class LocalClusterProvisioner implements ClusterProvisioner {

    private static final int IDLE_SECONDS = 30;
    private static final long READY_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

    private final AtomicInteger clusterIds = new AtomicInteger();

    @Override
    public ProvisionedCluster provision(WorkerSpec spec, int initialWorkers) {
        int threadsPerWorker = Math.max(1, spec.getThreadsPerWorker());
        int threads = Math.max(1, initialWorkers) * threadsPerWorker;

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(IDLE_SECONDS);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("fetch-pool-" + clusterIds.incrementAndGet() + "-");
        executor.initialize();

        log.info("Provisioned local cluster {} with {} worker(s), image {}, memory {}G/{}G, cpu {}/{}",
                executor.getThreadNamePrefix(), initialWorkers, spec.getImage(),
                spec.getMemoryRequestGb(), spec.getMemoryLimitGb(), spec.getCpuRequest(), spec.getCpuLimit());
        return new LocalCluster(executor, threadsPerWorker);
    }

    static class LocalCluster implements ProvisionedCluster {

        private final ThreadPoolTaskExecutor executor;
        private final int threadsPerWorker;

        LocalCluster(ThreadPoolTaskExecutor executor, int threadsPerWorker) {
            this.executor = executor;
            this.threadsPerWorker = threadsPerWorker;
        }

        @Override
        public synchronized void adapt(int minimum, int maximum) {
            if (minimum < 1 || maximum < minimum) {
                throw new IllegalArgumentException("Invalid worker bounds [" + minimum + ", " + maximum + "]");
            }
            int core = minimum * threadsPerWorker;
            int max = maximum * threadsPerWorker;
            // the pool rejects a core size above its current maximum and vice versa
            if (max >= executor.getCorePoolSize()) {
                executor.setMaxPoolSize(max);
                executor.setCorePoolSize(core);
            } else {
                executor.setCorePoolSize(core);
                executor.setMaxPoolSize(max);
            }
            log.debug("Adapted {} to {}-{} workers", executor.getThreadNamePrefix(), minimum, maximum);
        }

        @Override
        public boolean awaitWorkers(int workers, Duration timeout) throws InterruptedException {
            int required = workers * threadsPerWorker;
            if (required > executor.getMaxPoolSize()) {
                return false;
            }
            long deadline = System.nanoTime() + timeout.toNanos();
            while (true) {
                executor.getThreadPoolExecutor().prestartAllCoreThreads();
                if (executor.getPoolSize() >= required) {
                    return true;
                }
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("{} has {} of {} threads after {}", executor.getThreadNamePrefix(),
                            executor.getPoolSize(), required, timeout);
                    return false;
                }
                TimeUnit.NANOSECONDS.sleep(Math.min(remaining, READY_POLL_NANOS));
            }
        }

        @Override
        public Executor executor() {
            return executor;
        }

        @Override
        public int parallelism() {
            return executor.getMaxPoolSize();
        }

        @Override
        public void close() {
            executor.shutdown();
            log.debug("Closed local cluster {}", executor.getThreadNamePrefix());
        }
    }
}
