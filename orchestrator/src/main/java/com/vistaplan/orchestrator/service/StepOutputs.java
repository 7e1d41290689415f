package com.vistaplan.orchestrator.service;

import com.vistaplan.orchestrator.model.StepOutput;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Maps an accepted artifact to the StepOutput variant of its step. */
final class StepOutputs {

    private StepOutputs() {}

    static StepOutput forArtifact(int step, String serviceName, UUID artifactId, List<String> spaceIds) {
        return switch (step) {
            case 0  -> new StepOutput.SpaceAnalysis(artifactId, spaceIds);
            case 1  -> new StepOutput.TopDown3d(artifactId);
            case 2  -> new StepOutput.Styled(artifactId);
            case 3  -> new StepOutput.DetectedSpaces(artifactId, spaceIds);
            case 4  -> new StepOutput.CameraIntent(artifactId);
            case 5  -> new StepOutput.PromptTemplates(artifactId);
            case 6  -> new StepOutput.SpaceRenders(Map.of(serviceName, artifactId));
            case 7  -> new StepOutput.Panoramas(Map.of(serviceName, artifactId));
            case 8  -> new StepOutput.Tour(artifactId);
            default -> throw new IllegalArgumentException("No step " + step);
        };
    }

    /** Artifact ids a step hands to the next one as generation input. */
    static List<String> artifactIdsOf(StepOutput output) {
        if (output instanceof StepOutput.SpaceAnalysis o)   return List.of(o.analysisArtifactId().toString());
        if (output instanceof StepOutput.TopDown3d o)       return List.of(o.artifactId().toString());
        if (output instanceof StepOutput.Styled o)          return List.of(o.artifactId().toString());
        if (output instanceof StepOutput.DetectedSpaces o)  return List.of(o.analysisArtifactId().toString());
        if (output instanceof StepOutput.CameraIntent o)    return List.of(o.artifactId().toString());
        if (output instanceof StepOutput.PromptTemplates o) return List.of(o.artifactId().toString());
        if (output instanceof StepOutput.SpaceRenders o)    return o.artifactsByUnit().values().stream().map(UUID::toString).sorted().toList();
        if (output instanceof StepOutput.Panoramas o)       return o.artifactsByUnit().values().stream().map(UUID::toString).sorted().toList();
        if (output instanceof StepOutput.Tour o)            return List.of(o.tourArtifactId().toString());
        return List.of();
    }
}
