package com.datafetch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Time-series fetch-and-merge service.
 *
 * Accepts requests for one or more named time-series datasets over a time window, and
 * produces a single merged, time-aligned and plot-ready result as a background job.
 *
 * Architecture:
 * - REST API for job submission, size pre-flight checks, polling and cancellation
 * - Redis-backed request deduplication (one job per identical request)
 * - Job state and progress persisted through JPA
 * - Elastic worker pool for large requests, shared path for small ones
 * - Nearest-neighbour temporal merge onto a one-second grid
 * - Point-wise or binned rendering depending on sample count
 */
@SpringBootApplication
@EnableScheduling
public class DataFetchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataFetchApplication.class, args);
    }
}
