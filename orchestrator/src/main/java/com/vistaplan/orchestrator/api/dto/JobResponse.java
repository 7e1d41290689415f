package com.vistaplan.orchestrator.api.dto;

import com.vistaplan.orchestrator.model.PipelineJob;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a job. For a BLOCKED job, lastError holds the reason chain
 * and resultRef the best attempt's artifact id.
 */
public record JobResponse(
        UUID    id,
        UUID    runId,
        int     step,
        String  service,
        String  status,
        int     attempts,
        int     maxAttempts,
        String  lockHolder,
        Instant lockExpiresAt,
        Instant notBefore,
        String  resultRef,
        String  correctiveInstructions,
        String  lastError,
        Instant createdAt,
        Instant completedAt,
        Long    processingTimeMs
) {
    public static JobResponse from(PipelineJob j) {
        return new JobResponse(
                j.getId(),
                j.getRunId(),
                j.getStep(),
                j.getServiceName(),
                j.getStatus().name(),
                j.getAttempts(),
                j.getMaxAttempts(),
                j.getLockHolder(),
                j.getLockExpiresAt(),
                j.getNotBefore(),
                j.getResultRef(),
                j.getCorrectiveInstructions(),
                j.getLastError(),
                j.getCreatedAt(),
                j.getCompletedAt(),
                j.getProcessingTimeMs()
        );
    }
}
