package com.vistaplan.orchestrator.ledger;

import com.vistaplan.orchestrator.model.JobStatus;

import java.time.Instant;

/**
 * What to write when a lock holder lets go of a job.
 *
 * PENDING is the retry case: the lock is dropped and the job waits for
 * {@code notBefore} with corrective instructions for its next attempt.
 */
public record JobRelease(
        JobStatus status,
        String    resultRef,
        String    error,
        String    errorTrace,
        Instant   notBefore,
        String    correctiveInstructions
) {
    public static JobRelease completed(String resultRef) {
        return new JobRelease(JobStatus.COMPLETED, resultRef, null, null, null, null);
    }

    /** Blocked for a human; resultRef points at the best attempt, error holds the reason chain. */
    public static JobRelease blocked(String bestArtifactRef, String reasonChain) {
        return new JobRelease(JobStatus.BLOCKED, bestArtifactRef, reasonChain, null, null, null);
    }

    public static JobRelease failed(String error, String trace) {
        return new JobRelease(JobStatus.FAILED, null, error, trace, null, null);
    }

    public static JobRelease retryAfter(Instant notBefore, String correctiveInstructions, String reason) {
        return new JobRelease(JobStatus.PENDING, null, reason, null, notBefore, correctiveInstructions);
    }
}
