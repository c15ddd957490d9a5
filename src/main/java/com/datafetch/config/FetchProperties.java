package com.datafetch.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunables for the fetch-and-merge service.
 *
 * Every value can be overridden through the environment, e.g.
 * APP_FETCH_DATA_THRESHOLD_GB=20 or APP_FETCH_WORKER_IMAGE=repo/worker:tag.
 */
@ConfigurationProperties("app.fetch")
@Component
@Data
@Validated
public class FetchProperties {

    /**
     * Total estimated data size (GB) above which an elastic worker pool is provisioned.
     */
    @Positive
    private double dataThresholdGb = 50;

    /**
     * Memory limit of a single provisioned worker, in GB.
     */
    @Positive
    private double workerMemoryLimitGb = 16;

    /**
     * CPU limit of a single provisioned worker.
     */
    @Positive
    private double workerCpuLimit = 2;

    @Min(1)
    private int workerThreads = 2;

    /**
     * Worker container image as repository/name:tag.
     */
    @NotBlank
    private String workerImage = "datafetch/fetch-worker:1.0.0";

    @NotNull
    private Duration poolReadyTimeout = Duration.ofMinutes(5);

    /**
     * Sample count above which rendering switches to binned aggregation.
     */
    @Min(1)
    private int shadeThreshold = 500_000;

    @Min(1)
    private int plotWidth = 888;

    @Min(1)
    private int plotHeight = 450;

    /**
     * How long a terminal job and its result stay resolvable.
     */
    @NotNull
    private Duration resultRetention = Duration.ofDays(1);

    /**
     * Dedup pointers expire this much earlier than the job they point to.
     */
    @NotNull
    private Duration dedupTtlMargin = Duration.ofMinutes(5);

    @Min(1)
    private int jobThreads = 4;

    @Min(0)
    private int jobQueueCapacity = 100;

    @NotNull
    private Duration purgeInterval = Duration.ofMinutes(5);

    @NotBlank
    private String currentApiVersion = "2.0";

    @NotBlank
    private String packedApiVersion = "2.1";

    public Duration getDedupTtl() {
        return resultRetention.minus(dedupTtlMargin);
    }

    @AssertTrue(message = "dedup-ttl-margin must leave a positive dedup TTL below result-retention")
    public boolean isDedupTtlShorterThanRetention() {
        if (resultRetention == null || dedupTtlMargin == null) {
            return true;
        }
        return !dedupTtlMargin.isNegative() && !dedupTtlMargin.isZero()
                && getDedupTtl().compareTo(Duration.ZERO) > 0;
    }
}
