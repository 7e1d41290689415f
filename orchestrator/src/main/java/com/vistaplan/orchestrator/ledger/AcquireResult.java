package com.vistaplan.orchestrator.ledger;

import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of asking the ledger for a job's lock.
 *
 * Only ACQUIRED and RECLAIMED carry a token. ALREADY_RUNNING and DUPLICATE are
 * normal answers meaning "someone else has it" or "this was already done";
 * EXHAUSTED means the job's last attempt died holding the lock and the job was
 * failed instead of reclaimed.
 */
public record AcquireResult(Outcome outcome, LockToken token, UUID existingJobId) {

    public enum Outcome { ACQUIRED, RECLAIMED, ALREADY_RUNNING, DUPLICATE, EXHAUSTED }

    public static AcquireResult acquired(LockToken token) {
        return new AcquireResult(token.reclaimed() ? Outcome.RECLAIMED : Outcome.ACQUIRED,
                token, token.jobId());
    }

    public static AcquireResult alreadyRunning(UUID jobId) {
        return new AcquireResult(Outcome.ALREADY_RUNNING, null, jobId);
    }

    public static AcquireResult duplicate(UUID jobId) {
        return new AcquireResult(Outcome.DUPLICATE, null, jobId);
    }

    public static AcquireResult exhausted(UUID jobId) {
        return new AcquireResult(Outcome.EXHAUSTED, null, jobId);
    }

    public boolean holdsLock() {
        return token != null;
    }

    public Optional<LockToken> lockToken() {
        return Optional.ofNullable(token);
    }
}
