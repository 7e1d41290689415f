package com.vistaplan.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonRawValue;
import com.vistaplan.orchestrator.model.VerdictRecord;

import java.time.Instant;
import java.util.UUID;

/** One entry of a job's or run's verdict history; verdict is the stored verdict document. */
public record VerdictResponse(
        UUID    id,
        UUID    jobId,
        UUID    artifactId,
        int     step,
        int     attempt,
        boolean pass,
        String  nextStep,
        @JsonRawValue String verdict,
        Instant createdAt
) {
    public static VerdictResponse from(VerdictRecord r) {
        return new VerdictResponse(r.getId(), r.getJobId(), r.getArtifactId(), r.getStep(),
                r.getAttempt(), r.isPass(), r.getNextStep(), r.getVerdictJson(), r.getCreatedAt());
    }
}
