package com.vistaplan.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tunables for locking, retry budgets and dispatch.
 *
 * Bound from the {@code vistaplan.pipeline.*} block of application.yml; any
 * value left out falls back to the defaults below.
 */
@ConfigurationProperties(prefix = "vistaplan.pipeline")
public record PipelineProperties(
        Duration lockTtl,
        int      maxAttemptsPerJob,
        int      maxAttemptsPerRun,
        Duration retryBaseDelay,
        Duration retryMaxDelay,
        int      workerCount
) {
    public PipelineProperties {
        if (lockTtl == null)        lockTtl = Duration.ofMinutes(5);
        if (maxAttemptsPerJob <= 0) maxAttemptsPerJob = 3;
        if (maxAttemptsPerRun <= 0) maxAttemptsPerRun = 20;
        if (retryBaseDelay == null) retryBaseDelay = Duration.ofSeconds(2);
        if (retryMaxDelay == null)  retryMaxDelay = Duration.ofSeconds(30);
        if (workerCount <= 0)       workerCount = 4;
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, 0, 0, null, null, 0);
    }
}
