package com.vistaplan.orchestrator.api.dto;

import com.vistaplan.orchestrator.model.PromotionLogEntry;

import java.time.Instant;
import java.util.UUID;

public record PromotionLogResponse(
        UUID    id,
        String  type,
        UUID    ruleId,
        UUID    jobId,
        UUID    runId,
        String  ownerId,
        String  fromValue,
        String  toValue,
        String  reason,
        String  actor,
        Instant createdAt
) {
    public static PromotionLogResponse from(PromotionLogEntry e) {
        return new PromotionLogResponse(e.getId(), e.getPromotionType().name(), e.getRuleId(), e.getJobId(),
                e.getRunId(), e.getOwnerId(), e.getFromValue(), e.getToValue(), e.getTriggerReason(),
                e.getActor(), e.getCreatedAt());
    }
}
