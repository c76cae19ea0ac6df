package com.example.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the worker run loop.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "worker")
public class WorkerProperties {

    /**
     * Start the run loop automatically with the application context
     */
    private boolean enabled = true;

    /**
     * Maximum time a dequeue blocks waiting for new entries
     */
    @Min(100)
    private long blockMs = 5000;

    /**
     * Pause after an unexpected loop error before the next iteration
     */
    @Min(0)
    private long errorBackoffMs = 1000;

    /**
     * How long stop() waits for the run loop to finish
     */
    @Min(1)
    private int shutdownTimeoutSeconds = 30;

    /**
     * How long a timed out or cancelled task may take to roll back
     */
    @Min(1)
    private int rollbackGraceSeconds = 30;

    /**
     * Interval of the orphaned entry reclaim job
     */
    @Min(1000)
    private long orphanReclaimIntervalMs = 60000;

    /**
     * Idle time after which another consumer's pending entry is considered orphaned
     */
    @Min(1000)
    private long orphanMinIdleMs = 300000;

    /**
     * Maximum entries claimed per reclaim run
     */
    @Min(1)
    private int orphanClaimBatchSize = 100;

    /**
     * Refresh interval of the queue gauges
     */
    @Min(1000)
    private long metricsUpdateIntervalMs = 30000;
}
