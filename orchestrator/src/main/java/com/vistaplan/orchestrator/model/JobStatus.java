package com.vistaplan.orchestrator.model;

/**
 * Lifecycle of a pipeline job row.
 *
 * PENDING  → waiting for a worker (fresh request, or a retry whose back-off has not elapsed)
 * RUNNING  → held by a lock holder until lockExpiresAt
 * COMPLETED, BLOCKED → terminal
 * FAILED   → terminal; a collaborator kept failing or the lock was never released
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    BLOCKED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == BLOCKED;
    }
}
