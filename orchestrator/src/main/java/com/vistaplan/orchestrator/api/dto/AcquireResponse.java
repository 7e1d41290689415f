package com.vistaplan.orchestrator.api.dto;

import com.vistaplan.orchestrator.ledger.AcquireResult;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Outcome of an acquire. Contention is a normal answer, not an error:
 * "already_running" and "duplicate" carry the id of the job that blocks the caller.
 */
public record AcquireResponse(
        String  outcome,
        UUID    jobId,
        String  holder,
        Integer attempt,
        Instant lockExpiresAt
) {
    public static AcquireResponse from(AcquireResult r) {
        String outcome = r.outcome().name().toLowerCase(Locale.ROOT);
        return r.lockToken()
                .map(t -> new AcquireResponse(outcome, t.jobId(), t.holder(), t.attempt(), t.expiresAt()))
                .orElseGet(() -> new AcquireResponse(outcome, r.existingJobId(), null, null, null));
    }
}
