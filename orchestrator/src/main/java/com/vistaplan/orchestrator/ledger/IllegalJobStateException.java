package com.vistaplan.orchestrator.ledger;

import com.vistaplan.orchestrator.model.JobStatus;

import java.util.UUID;

/** The job exists but is in the wrong status for the requested operation. */
public class IllegalJobStateException extends RuntimeException {

    private final UUID      jobId;
    private final JobStatus status;

    public IllegalJobStateException(UUID jobId, JobStatus status, String message) {
        super("Job " + jobId + " is " + status + ": " + message);
        this.jobId  = jobId;
        this.status = status;
    }

    public UUID      getJobId()  { return jobId; }
    public JobStatus getStatus() { return status; }
}
