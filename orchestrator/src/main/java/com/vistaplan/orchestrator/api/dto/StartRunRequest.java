package com.vistaplan.orchestrator.api.dto;

/**
 * Request body for POST /runs.
 *
 * Required: ownerId
 * Optional: qualityTier ("1K" | "2K" | "4K", default 2K), userRequest and
 * styleConstraints, which the semantic judge compares the outputs against.
 */
public record StartRunRequest(
        String ownerId,
        String qualityTier,
        String userRequest,
        String styleConstraints
) {}
