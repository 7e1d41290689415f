package com.vistaplan.orchestrator.ledger;

import java.util.UUID;

/**
 * The caller tried to write a job it no longer holds: its TTL expired and the
 * job was reclaimed, or recovered by the sweep.
 */
public class LockLostException extends RuntimeException {

    private final UUID jobId;

    public LockLostException(UUID jobId, String holder, String actualHolder) {
        super("Lock on job %s lost by '%s' (now held by %s)"
                .formatted(jobId, holder, actualHolder == null ? "nobody" : "'" + actualHolder + "'"));
        this.jobId = jobId;
    }

    public UUID getJobId() { return jobId; }
}
