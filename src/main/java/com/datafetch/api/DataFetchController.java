package com.datafetch.api;

import com.datafetch.domain.model.CancelRequest;
import com.datafetch.domain.model.CancelResponse;
import com.datafetch.domain.model.CancelSignal;
import com.datafetch.domain.model.FetchRequest;
import com.datafetch.domain.model.JobStatusResponse;
import com.datafetch.domain.model.SizeCheckResponse;
import com.datafetch.domain.model.SizeCheckResult;
import com.datafetch.domain.model.SubmitResponse;
import com.datafetch.domain.model.SubmitResult;
import com.datafetch.domain.service.DataSizes;
import com.datafetch.domain.service.FetchJobOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * REST API for fetch jobs.
 *
 * Endpoints:
 * - GET  /api/v1/data/status - Service liveness
 * - POST /api/v1/data - Submit a fetch request (deduplicated)
 * - POST /api/v1/data/check - Size estimate without creating a job
 * - GET  /api/v1/data/job/{jobId}?version=2.0|2.1 - Job status as JSON or MessagePack
 * - POST /api/v1/data/job/{jobId}/cancel - Signal a pending or running job
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/data")
@RequiredArgsConstructor
public class DataFetchController {

    static final String JOB_PATH = "/api/v1/data/job/";

    private final FetchJobOrchestrator orchestrator;
    private final JobStatusEncoder statusEncoder;

    @GetMapping("/status")
    public ResponseEntity<Map<String, String>> status() {
        return ResponseEntity.ok(Map.of("status", "running", "message", "Data service is up."));
    }

    /**
     * Submit a fetch request.
     *
     * Request body:
     * {
     *   "refs": ["dataset-a", "dataset-b"],
     *   "axis": {"x": "time", "y": "temperature", "z": "", "color": ""},
     *   "startDt": "2020-01-01T00:00:00Z",
     *   "endDt": "2020-01-02T00:00:00Z"
     * }
     *
     * An identical earlier request yields the id of its job instead of a new one.
     */
    @PostMapping
    public ResponseEntity<SubmitResponse> submit(@Valid @RequestBody FetchRequest request) {
        log.info("Submit fetch: refs={}, axis={}", request.getRefs(), request.getAxis());

        SubmitResult submitted = orchestrator.submit(request);
        UUID jobId = submitted.getJobId();

        SubmitResponse response = SubmitResponse.builder()
                .status("success")
                .jobUuid(jobId)
                .resultUrl(JOB_PATH + jobId)
                .msg("Job " + jobId + " created.")
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @PostMapping("/check")
    public ResponseEntity<SizeCheckResponse> check(@Valid @RequestBody FetchRequest request) {
        log.info("Size check: refs={}", request.getRefs());

        SizeCheckResult sizes = orchestrator.checkSize(request);

        SizeCheckResponse response = SizeCheckResponse.builder()
                .status("success")
                .dataSizes(sizes.getDataSizes())
                .totalSize(sizes.getTotalSize())
                .msg("Max data request: " + DataSizes.format(sizes.getTotalSize()))
                .build();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    /**
     * Job status and, once succeeded, its result. Never blocks on the job.
     */
    @GetMapping("/job/{jobId}")
    public ResponseEntity<?> getJob(@PathVariable UUID jobId,
                                    @RequestParam(required = false) String version) {
        String resolved = statusEncoder.requireSupported(version);
        log.debug("Get job status: jobId={}, version={}", jobId, resolved);

        JobStatusResponse status = JobStatusResponse.from(orchestrator.getStatus(jobId));
        return statusEncoder.encode(status, resolved);
    }

    @PostMapping("/job/{jobId}/cancel")
    public ResponseEntity<CancelResponse> cancel(@PathVariable UUID jobId,
                                                 @Valid @RequestBody CancelRequest request) {
        CancelSignal signal = CancelSignal.parse(request.getSignal());
        log.info("Cancel job: jobId={}, signal={}", jobId, signal);

        boolean delivered = orchestrator.cancel(jobId, signal);
        String message = delivered
                ? "Signal " + signal + " sent to job " + jobId + "."
                : "Job " + jobId + " already finished.";
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new CancelResponse("success", signal, message));
    }
}
