package com.vistaplan.orchestrator.service;

import java.util.UUID;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(UUID runId) {
        super("Run not found: " + runId);
    }
}
