package com.vistaplan.orchestrator.api.dto;

/** Request body for POST /runs/{id}/jobs/acquire. */
public record AcquireRequest(
        int    step,
        String service,
        String idempotencyKey,
        String holder
) {}
