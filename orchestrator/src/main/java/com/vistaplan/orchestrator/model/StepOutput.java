package com.vistaplan.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * What a completed step hands to the steps after it.
 *
 * One variant per step, discriminated by the "kind" property on the wire:
 * <pre>
 *   {"kind":"space_analysis","analysisArtifactId":"…","spaceIds":["space_kitchen"]}
 * </pre>
 * Sub-unit steps (renders, panoramas) accumulate one artifact per space.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StepOutput.SpaceAnalysis.class,   name = "space_analysis"),
        @JsonSubTypes.Type(value = StepOutput.TopDown3d.class,       name = "top_down_3d"),
        @JsonSubTypes.Type(value = StepOutput.Styled.class,          name = "style"),
        @JsonSubTypes.Type(value = StepOutput.DetectedSpaces.class,  name = "detect_spaces"),
        @JsonSubTypes.Type(value = StepOutput.CameraIntent.class,    name = "camera_intent"),
        @JsonSubTypes.Type(value = StepOutput.PromptTemplates.class, name = "prompt_templates"),
        @JsonSubTypes.Type(value = StepOutput.SpaceRenders.class,    name = "outputs"),
        @JsonSubTypes.Type(value = StepOutput.Panoramas.class,       name = "panoramas"),
        @JsonSubTypes.Type(value = StepOutput.Tour.class,            name = "merging")
})
public sealed interface StepOutput {

    @JsonIgnore
    int step();

    record SpaceAnalysis(UUID analysisArtifactId, List<String> spaceIds) implements StepOutput {
        public int step() { return 0; }
    }

    record TopDown3d(UUID artifactId) implements StepOutput {
        public int step() { return 1; }
    }

    record Styled(UUID artifactId) implements StepOutput {
        public int step() { return 2; }
    }

    record DetectedSpaces(UUID analysisArtifactId, List<String> spaceIds) implements StepOutput {
        public int step() { return 3; }
    }

    record CameraIntent(UUID artifactId) implements StepOutput {
        public int step() { return 4; }
    }

    record PromptTemplates(UUID artifactId) implements StepOutput {
        public int step() { return 5; }
    }

    /** Accepted render per sub-unit (service name → artifact id). */
    record SpaceRenders(Map<String, UUID> artifactsByUnit) implements StepOutput {
        public int step() { return 6; }
    }

    record Panoramas(Map<String, UUID> artifactsByUnit) implements StepOutput {
        public int step() { return 7; }
    }

    record Tour(UUID tourArtifactId) implements StepOutput {
        public int step() { return 8; }
    }
}
