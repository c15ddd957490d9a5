package com.datafetch.domain.service;

import com.datafetch.config.FetchProperties;
import com.datafetch.domain.merge.TemporalMergeEngine;
import com.datafetch.domain.model.AxisMapping;
import com.datafetch.domain.model.CancelSignal;
import com.datafetch.domain.model.ComputeContext;
import com.datafetch.domain.model.FetchRequest;
import com.datafetch.domain.model.FetchResult;
import com.datafetch.domain.model.JobSnapshot;
import com.datafetch.domain.model.SizeCheckResult;
import com.datafetch.domain.model.SizingPlan;
import com.datafetch.domain.model.SubmitResult;
import com.datafetch.domain.model.TimeSeriesDataset;
import com.datafetch.domain.pool.ElasticPool;
import com.datafetch.domain.pool.ElasticPoolController;
import com.datafetch.domain.pool.PoolProvisioningException;
import com.datafetch.domain.pool.SizingEstimator;
import com.datafetch.domain.render.RenderOptions;
import com.datafetch.domain.render.RenderResult;
import com.datafetch.domain.render.RenderingStrategySelector;
import com.datafetch.infrastructure.cache.DedupReservation;
import com.datafetch.infrastructure.cache.JobCancellationRegistry;
import com.datafetch.infrastructure.cache.RequestDeduplicationCache;
import com.datafetch.infrastructure.dataset.DatasetHandle;
import com.datafetch.infrastructure.dataset.DatasetResolutionException;
import com.datafetch.infrastructure.dataset.DatasetResolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Accepts fetch requests and runs each one as a background job.
 *
 * Submission Flow:
 * 1. Fingerprint the request
 * 2. Look up the fingerprint in the dedup cache; on a miss persist a PENDING job and publish it
 * 3. Queue the published job on the job executor
 * 4. Return the job id immediately; clients poll for progress and result
 *
 * Job Flow (sequential on the job thread):
 * 1. Resolve datasets and estimate the projected size
 * 2. Above the size threshold, acquire an elastic pool for this job only
 * 3. Fetch the time window, validate, merge onto the common grid, render
 * 4. Store the result, or a failure reason with no result
 *
 * Cancellation is cooperative and observed between steps. Every exception raised inside a job
 * ends in a terminal job state; nothing propagates past the job boundary. The elastic pool is
 * released on every exit path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FetchJobOrchestrator {

    static final String NO_DATA = "One of the datasets does not contain data.";
    static final String EMPTY_MERGE = "Merged dataset does not contain data.";
    static final String RESULT_READY = "Result ready.";

    private final FingerprintService fingerprintService;
    private final RequestDeduplicationCache dedupCache;
    private final JobCancellationRegistry cancellationRegistry;
    private final FetchJobService jobService;
    private final DatasetResolver datasetResolver;
    private final SizingEstimator sizingEstimator;
    private final ElasticPoolController poolController;
    private final TemporalMergeEngine mergeEngine;
    private final RenderingStrategySelector renderer;
    private final FetchProperties properties;
    private final MeterRegistry meterRegistry;
    private final ThreadPoolTaskExecutor fetchJobExecutor;

    /**
     * Returns the job serving this request, creating and queueing one if no identical request
     * is already known.
     */
    public SubmitResult submit(FetchRequest request) {
        String fingerprint = fingerprintService.fingerprint(request);

        DedupReservation reservation = dedupCache.lookupOrCreate(fingerprint,
                jobId -> jobService.create(jobId, fingerprint, request),
                jobService::discard);

        if (!reservation.isCreated()) {
            countDedup("hit");
            log.info("Request deduplicated to existing job {}", reservation.getJobId());
            return new SubmitResult(reservation.getJobId(), false);
        }

        countDedup(reservation.isBypassed() ? "bypassed" : "miss");
        dispatch(fingerprint, reservation.getJobId(), request);
        log.info("Job {} submitted ({} datasets)", reservation.getJobId(), request.datasetIds().size());
        return new SubmitResult(reservation.getJobId(), reservation.isCreated());
    }

    /**
     * Size estimate over the request's variable projection. Creates no job.
     *
     * @throws DatasetResolutionException if a dataset or variable is unknown
     */
    public SizeCheckResult checkSize(FetchRequest request) {
        Map<String, Long> sizes = new LinkedHashMap<>();
        long total = 0;
        for (DatasetHandle handle : resolve(request)) {
            sizes.put(handle.getDatasetId(), handle.getEstimatedBytes());
            total += handle.getEstimatedBytes();
        }
        return SizeCheckResult.builder()
                .dataSizes(sizes)
                .totalSize(total)
                .build();
    }

    public JobSnapshot getStatus(UUID jobId) {
        return jobService.snapshot(jobId);
    }

    /**
     * Requests cancellation of a pending or running job.
     *
     * @return false if the job had already reached a terminal state; nothing is changed then
     * @throws JobNotFoundException if the job is unknown
     */
    public boolean cancel(UUID jobId, CancelSignal signal) {
        JobSnapshot snapshot = jobService.snapshot(jobId);
        if (snapshot.getState().isTerminal()) {
            log.debug("Ignoring {} for job {} in state {}", signal, jobId, snapshot.getState());
            return false;
        }
        cancellationRegistry.signal(jobId, signal);
        log.info("Cancellation {} requested for job {}", signal, jobId);
        return true;
    }

    private void dispatch(String fingerprint, UUID jobId, FetchRequest request) {
        try {
            fetchJobExecutor.execute(() -> runJob(jobId, request));
        } catch (TaskRejectedException e) {
            jobService.reject(jobId, "Job queue is full. Please try again later.");
            dedupCache.release(fingerprint, jobId);
            throw e;
        }
    }

    void runJob(UUID jobId, FetchRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        JobProgress job;
        try {
            job = jobService.open(jobId);
        } catch (RuntimeException e) {
            log.error("Job {} cannot be loaded, not running it: {}", jobId, e.getMessage(), e);
            return;
        }

        CancellationToken token = new CancellationToken(jobId, cancellationRegistry);
        String outcome;
        try {
            token.checkpoint();
            job.start();
            outcome = execute(job, request, token);

        } catch (JobCancelledException e) {
            outcome = terminate(job, () -> job.cancel("Job cancelled by " + e.getSignal() + "."), "cancelled");

        } catch (PoolProvisioningException e) {
            log.warn("Job {} could not get a compute cluster: {}", jobId, e.getMessage());
            outcome = terminate(job, () -> job.fail("Error occurred: " + e.getMessage()), "failed");

        } catch (Exception e) {
            log.error("Error processing job {}: {}", jobId, e.getMessage(), e);
            outcome = terminate(job, () -> job.fail("Error occurred: " + e.getMessage()), "failed");
        }

        Counter.builder("fetch.jobs")
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
        sample.stop(meterRegistry.timer("fetch.job.duration"));
    }

    private String execute(JobProgress job, FetchRequest request, CancellationToken token) {
        List<String> datasetIds = request.datasetIds();
        job.report(datasetIds.size() + " datasets requested.");

        List<DatasetHandle> handles;
        try {
            handles = resolve(request);
        } catch (DatasetResolutionException e) {
            job.fail(e.getMessage());
            return "failed";
        }

        long totalBytes = handles.stream().mapToLong(DatasetHandle::getEstimatedBytes).sum();
        job.report("Estimated data size: " + DataSizes.format(totalBytes) + ".");
        token.checkpoint();

        if (!sizingEstimator.requiresElasticPool(totalBytes)) {
            return process(job, request, handles, ComputeContext.direct(), token);
        }

        SizingPlan plan = sizingEstimator.plan(totalBytes);
        job.report("Setting up distributed computing cluster. Max data size: " + DataSizes.format(totalBytes));
        try (ElasticPool pool = poolController.acquire(plan)) {
            job.report("Compute cluster ready with " + plan.getMinWorkers() + "-" + plan.getMaxWorkers() + " workers.");
            return process(job, request, handles, pool.computeContext(), token);
        }
    }

    private String process(JobProgress job,
                           FetchRequest request,
                           List<DatasetHandle> handles,
                           ComputeContext context,
                           CancellationToken token) {
        AxisMapping axis = request.getAxis();

        job.report("Retrieving data from store ...");
        Map<String, TimeSeriesDataset> datasets = new LinkedHashMap<>();
        for (DatasetHandle handle : handles) {
            token.checkpoint();
            Optional<TimeSeriesDataset> fetched = handle.fetch(request.getStartDt(), request.getEndDt());
            if (fetched.isEmpty()) {
                job.fail(NO_DATA);
                return "failed";
            }
            datasets.put(handle.getDatasetId(), fetched.get());
        }

        job.report("Validating datasets...");
        List<String> emptyStreams = new ArrayList<>();
        long fetchedBytes = 0;
        for (Map.Entry<String, TimeSeriesDataset> entry : datasets.entrySet()) {
            if (entry.getValue().isEmpty()) {
                emptyStreams.add(entry.getKey());
            }
            fetchedBytes += entry.getValue().estimatedBytes();
        }
        if (!emptyStreams.isEmpty()) {
            job.fail("Empty data stream(s) found: " + String.join(",", emptyStreams)
                    + ". Plot creation is not possible with specified parameters. Please try again.");
            return "failed";
        }
        job.report("There are " + DataSizes.format(fetchedBytes) + " of data to be processed.");
        token.checkpoint();

        job.report("Merging datasets...");
        TimeSeriesDataset merged = mergeEngine.merge(datasets, request.getStartDt(), request.getEndDt(), context);
        if (merged.isEmpty()) {
            job.fail(EMPTY_MERGE);
            return "failed";
        }
        for (String variable : new String[] {axis.getX(), axis.getY()}) {
            if (isAllMissing(merged, variable)) {
                job.fail("Variable '" + variable + "' does not contain data in the requested time range.");
                return "failed";
            }
        }
        token.checkpoint();

        job.report("Plotting merged datasets...");
        RenderOptions options = RenderOptions.builder()
                .shadeThreshold(properties.getShadeThreshold())
                .width(properties.getPlotWidth())
                .height(properties.getPlotHeight())
                .build();
        RenderResult rendered = renderer.render(merged, axis, options, context);
        token.checkpoint();

        job.succeed(toResult(rendered, axis, merged.size()), RESULT_READY);
        return "succeeded";
    }

    private List<DatasetHandle> resolve(FetchRequest request) {
        List<String> projection = request.getAxis().variableProjection();
        List<DatasetHandle> handles = new ArrayList<>();
        for (String datasetId : request.datasetIds()) {
            handles.add(datasetResolver.resolve(datasetId, projection));
        }
        return handles;
    }

    /**
     * The third column is the color the plot was keyed by (a mapped color variable or the shaded
     * aggregate), else the mapped z variable, else empty.
     */
    static FetchResult toResult(RenderResult rendered, AxisMapping axis, long count) {
        Map<String, List<Object>> columns = rendered.getColumns();
        String colorColumn = rendered.getColorColumn();
        List<Object> z;
        if (colorColumn != null && columns.containsKey(colorColumn)) {
            z = columns.get(colorColumn);
        } else if (axis.hasZ()) {
            z = columns.get(axis.getZ());
        } else {
            z = List.of();
        }
        return FetchResult.builder()
                .x(columns.get(axis.getX()))
                .y(columns.get(axis.getY()))
                .z(z == null ? List.of() : z)
                .count(count)
                .shaded(rendered.isShaded())
                .build();
    }

    private static boolean isAllMissing(TimeSeriesDataset dataset, String variable) {
        if (TimeSeriesDataset.TIME.equals(variable)) {
            return false;
        }
        for (double value : dataset.values(variable)) {
            if (!Double.isNaN(value)) {
                return false;
            }
        }
        return true;
    }

    private String terminate(JobProgress job, Runnable transition, String outcome) {
        if (job.getState().isTerminal()) {
            return outcome;
        }
        try {
            transition.run();
        } catch (RuntimeException e) {
            log.error("Could not record terminal state of job {}: {}", job.getJobId(), e.getMessage(), e);
        }
        return outcome;
    }

    private void countDedup(String result) {
        Counter.builder("fetch.dedup")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
