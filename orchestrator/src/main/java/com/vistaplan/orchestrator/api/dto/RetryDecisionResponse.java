package com.vistaplan.orchestrator.api.dto;

import com.vistaplan.orchestrator.retry.RetryDecision;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

public record RetryDecisionResponse(
        String  outcome,
        Instant notBefore,
        String  correctiveInstructions,
        UUID    bestArtifactId,
        String  reason
) {
    public static RetryDecisionResponse from(RetryDecision d) {
        return new RetryDecisionResponse(d.outcome().name().toLowerCase(Locale.ROOT), d.notBefore(),
                d.correctiveInstructions(), d.bestArtifactId(), d.reason());
    }
}
