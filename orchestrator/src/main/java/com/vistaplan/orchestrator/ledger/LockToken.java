package com.vistaplan.orchestrator.ledger;

import java.time.Instant;
import java.util.UUID;

/**
 * Proof of holding a job's lock. Every write to a RUNNING job must present one.
 *
 * @param attempt   the job's attempt count after this acquire
 * @param reclaimed true when the lock was taken over from a holder whose TTL expired
 */
public record LockToken(
        UUID    jobId,
        UUID    runId,
        int     step,
        String  serviceName,
        String  holder,
        int     attempt,
        Instant expiresAt,
        boolean reclaimed
) {
    public LockToken withExpiry(Instant newExpiry) {
        return new LockToken(jobId, runId, step, serviceName, holder, attempt, newExpiry, reclaimed);
    }
}
