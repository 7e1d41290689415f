package com.vistaplan.orchestrator.retry;

import java.time.Instant;
import java.util.UUID;

/**
 * What happens to a job after its verdict.
 *
 * @param notBefore              RETRY only
 * @param correctiveInstructions RETRY only
 * @param bestArtifactId         BLOCKED only; may be null when no attempt produced an artifact
 * @param reason                 one line for PROCEED/RETRY, the full reason chain for BLOCKED
 */
public record RetryDecision(
        Outcome outcome,
        Instant notBefore,
        String  correctiveInstructions,
        UUID    bestArtifactId,
        String  reason
) {
    public enum Outcome { PROCEED, RETRY, BLOCKED }

    public static RetryDecision proceed(String reason) {
        return new RetryDecision(Outcome.PROCEED, null, null, null, reason);
    }

    public static RetryDecision retry(Instant notBefore, String instructions, String reason) {
        return new RetryDecision(Outcome.RETRY, notBefore, instructions, null, reason);
    }

    public static RetryDecision blocked(UUID bestArtifactId, String reasonChain) {
        return new RetryDecision(Outcome.BLOCKED, null, null, bestArtifactId, reasonChain);
    }
}
