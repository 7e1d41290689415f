package com.vistaplan.orchestrator.api.dto;

import java.util.List;

/** Request body for POST /runs/{id}/jobs. */
public record JobRequest(
        int          step,
        String       service,
        String       idempotencyKey,
        List<String> inputArtifactIds
) {}
