package com.vistaplan.orchestrator.api.dto;

import com.vistaplan.orchestrator.model.PolicyRule;

import java.time.Instant;
import java.util.UUID;

public record RuleResponse(
        UUID    id,
        String  scope,
        String  ownerId,
        UUID    runId,
        int     step,
        String  category,
        String  ruleText,
        int     violationCount,
        String  strengthStage,
        int     health,
        double  confidenceScore,
        int     triggeredCount,
        boolean confidenceCapped,
        boolean muted,
        boolean locked,
        boolean disabled,
        Instant lastTriggeredAt,
        Instant createdAt
) {
    public static RuleResponse from(PolicyRule r) {
        return new RuleResponse(
                r.getId(),
                r.getScope().name(),
                r.getOwnerId(),
                r.getRunId(),
                r.getStep(),
                r.getCategory(),
                r.getRuleText(),
                r.getViolationCount(),
                r.getStrengthStage().name(),
                r.getHealth(),
                r.getConfidenceScore(),
                r.getTriggeredCount(),
                r.isConfidenceCapped(),
                r.isMuted(),
                r.isLocked(),
                r.isDisabled(),
                r.getLastTriggeredAt(),
                r.getCreatedAt()
        );
    }
}
