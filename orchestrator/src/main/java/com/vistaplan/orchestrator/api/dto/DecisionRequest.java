package com.vistaplan.orchestrator.api.dto;

import com.vistaplan.orchestrator.service.HumanDecision;

/** Request body for POST /jobs/{id}/decision. */
public record DecisionRequest(HumanDecision decision, String actor, String reason) {}
