package com.vistaplan.orchestrator.api.dto;

import com.vistaplan.orchestrator.model.PipelineRun;
import com.vistaplan.orchestrator.model.StepOutput;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/** Response body for the run endpoints; the pull-based view of a run's progress. */
public record RunResponse(
        UUID                    id,
        String                  ownerId,
        String                  phase,
        int                     currentStep,
        String                  qualityTier,
        boolean                 paused,
        String                  lastError,
        Map<Integer, StepOutput> stepOutputs,
        Instant                 createdAt,
        Instant                 updatedAt
) {
    public static RunResponse from(PipelineRun run, Map<Integer, StepOutput> stepOutputs) {
        return new RunResponse(
                run.getId(),
                run.getOwnerId(),
                run.getPhase().wireName(),
                run.getCurrentStep(),
                run.getQualityTier().label(),
                run.isPaused(),
                run.getLastError(),
                stepOutputs,
                run.getCreatedAt(),
                run.getUpdatedAt()
        );
    }
}
