package com.vistaplan.orchestrator.validation;

import com.vistaplan.orchestrator.model.Artifact;

import java.util.UUID;

/** The slice of an artifact the engine looks at. */
public record ArtifactUnderReview(
        UUID    runId,
        int     step,
        UUID    artifactId,
        Integer width,
        Integer height,
        String  analysisJson
) {
    public static ArtifactUnderReview of(Artifact a) {
        return new ArtifactUnderReview(a.getRunId(), a.getStep(), a.getId(),
                a.getWidth(), a.getHeight(), a.getAnalysisJson());
    }
}
