package com.vistaplan.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for calls to external collaborators (the semantic judge and the
 * generation service). Bound from {@code vistaplan.collaborators.*}.
 */
@ConfigurationProperties(prefix = "vistaplan.collaborators")
public record JudgeProperties(
        String   judgeModel,
        Duration judgeTimeout,
        Duration generationTimeout,
        int      retryAttempts,
        Duration retryWait
) {
    public JudgeProperties {
        if (judgeModel == null || judgeModel.isBlank()) judgeModel = "claude-sonnet-4-6";
        if (judgeTimeout == null)      judgeTimeout = Duration.ofMinutes(2);
        if (generationTimeout == null) generationTimeout = Duration.ofMinutes(3);
        if (retryAttempts <= 0)        retryAttempts = 3;
        if (retryWait == null)         retryWait = Duration.ofSeconds(2);
    }

    public static JudgeProperties defaults() {
        return new JudgeProperties(null, null, null, 0, null);
    }
}
