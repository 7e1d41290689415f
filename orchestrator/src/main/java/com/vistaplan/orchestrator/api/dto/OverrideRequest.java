package com.vistaplan.orchestrator.api.dto;

import com.vistaplan.orchestrator.learning.RuleOverride;

/** Request body for POST /rules/{id}/overrides. */
public record OverrideRequest(RuleOverride override, String actor, String reason) {}
