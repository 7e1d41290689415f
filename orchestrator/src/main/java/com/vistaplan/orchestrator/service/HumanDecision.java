package com.vistaplan.orchestrator.service;

/** A reviewer's terminal call on a blocked job. */
public enum HumanDecision {
    /** Accept the best attempt as the step's output. */
    APPROVE,
    /** Stop the job; the run keeps its last error until someone restarts the step. */
    REJECT_AND_STOP
}
