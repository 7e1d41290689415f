package com.vistaplan.orchestrator.service;

import java.util.UUID;

/**
 * New work for a run was refused. Nothing was written.
 */
public class DispatchRefusedException extends RuntimeException {

    public enum Reason { RUN_PAUSED, WRONG_STEP, RUN_COMPLETED }

    private final Reason reason;
    private final UUID   runId;

    public DispatchRefusedException(Reason reason, UUID runId, String message) {
        super("[" + reason + "] run " + runId + ": " + message);
        this.reason = reason;
        this.runId  = runId;
    }

    public Reason getReason() { return reason; }
    public UUID   getRunId()  { return runId; }
}
