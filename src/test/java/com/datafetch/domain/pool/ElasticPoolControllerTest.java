package com.datafetch.domain.pool;

import com.datafetch.config.FetchProperties;
import com.datafetch.domain.model.SizingPlan;
import com.datafetch.domain.model.WorkerSpec;
import com.datafetch.infrastructure.cluster.ClusterProvisioner;
import com.datafetch.infrastructure.cluster.ProvisionedCluster;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ElasticPoolControllerTest {

    @Mock
    private ClusterProvisioner provisioner;

    @Mock
    private ProvisionedCluster cluster;

    private MeterRegistry meterRegistry;
    private ElasticPoolController controller;

    private final SizingPlan plan = SizingPlan.builder()
            .minWorkers(2)
            .maxWorkers(13)
            .workerSpec(WorkerSpec.builder().image("datafetch/fetch-worker:1.0.0").threadsPerWorker(2).build())
            .totalBytes(200L << 30)
            .build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        controller = new ElasticPoolController(provisioner, new FetchProperties(), meterRegistry);
    }

    @Test
    void testAcquire_AdaptsWithPlanBounds() throws Exception {
        // Given
        Executor executor = Runnable::run;
        when(provisioner.provision(plan.getWorkerSpec(), 2)).thenReturn(cluster);
        when(cluster.awaitWorkers(eq(2), any(Duration.class))).thenReturn(true);
        when(cluster.executor()).thenReturn(executor);
        when(cluster.parallelism()).thenReturn(26);

        // When
        ElasticPool pool = controller.acquire(plan);

        // Then
        assertEquals(PoolState.ACTIVE, pool.getState());
        assertSame(executor, pool.computeContext().getExecutor());
        assertEquals(26, pool.computeContext().getParallelism());
        InOrder inOrder = inOrder(cluster);
        inOrder.verify(cluster).adapt(2, 13);
        inOrder.verify(cluster).awaitWorkers(eq(2), any(Duration.class));
        assertEquals(1.0, meterRegistry.counter("fetch.pool", "event", "acquired").count());
    }

    @Test
    void testRelease_TearsDownExactlyOnce() throws Exception {
        // Given
        when(provisioner.provision(any(), anyInt())).thenReturn(cluster);
        when(cluster.awaitWorkers(anyInt(), any())).thenReturn(true);
        ElasticPool pool = controller.acquire(plan);

        // When
        pool.close();
        pool.close();
        controller.release(pool);

        // Then
        verify(cluster, times(1)).close();
        assertEquals(PoolState.CLOSED, pool.getState());
        assertThrows(IllegalStateException.class, pool::computeContext);
    }

    @Test
    void testAcquire_ProvisionerFailureIsFatal() {
        // Given
        when(provisioner.provision(any(), anyInt())).thenThrow(new IllegalStateException("quota exceeded"));

        // When / Then
        PoolProvisioningException e = assertThrows(PoolProvisioningException.class, () -> controller.acquire(plan));
        assertTrue(e.getMessage().contains("quota exceeded"));
        verify(provisioner, times(1)).provision(any(), anyInt());
        assertEquals(1.0, meterRegistry.counter("fetch.pool", "event", "failed").count());
    }

    @Test
    void testAcquire_NotReadyInTimeTearsDown() throws Exception {
        // Given
        when(provisioner.provision(any(), anyInt())).thenReturn(cluster);
        when(cluster.awaitWorkers(anyInt(), any())).thenReturn(false);

        // When / Then
        assertThrows(PoolProvisioningException.class, () -> controller.acquire(plan));
        verify(cluster).close();
    }

    @Test
    void testRelease_TeardownFailureIsSwallowed() throws Exception {
        // Given
        when(provisioner.provision(any(), anyInt())).thenReturn(cluster);
        when(cluster.awaitWorkers(anyInt(), any())).thenReturn(true);
        doThrow(new IllegalStateException("scheduler gone")).when(cluster).close();
        ElasticPool pool = controller.acquire(plan);

        // When / Then
        assertDoesNotThrow(pool::close);
        assertEquals(PoolState.CLOSED, pool.getState());
    }
}
