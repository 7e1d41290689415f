package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The space-analysis document a generation step returns alongside its image.
 * Only built after {@link AnalysisSchemaValidator} has accepted the raw JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpaceAnalysis(
        @JsonProperty("run_id")             String              runId,
        @JsonProperty("step_id")            String              stepId,
        @JsonProperty("spaces")             List<DetectedSpace> spaces,
        @JsonProperty("global_notes")       String              globalNotes,
        @JsonProperty("processing_time_ms") long                processingTimeMs,
        @JsonProperty("model_used")         String              modelUsed
) {
    public SpaceAnalysis {
        spaces = spaces == null ? List.of() : List.copyOf(spaces);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DetectedSpace(
            @JsonProperty("space_id")            String          spaceId,
            @JsonProperty("label")               String          label,
            @JsonProperty("category")            String          category,
            @JsonProperty("confidence")          double          confidence,
            @JsonProperty("detected_furnishings") List<Furnishing> detectedFurnishings,
            @JsonProperty("geometry_notes")      String          geometryNotes,
            @JsonProperty("ambiguity_flags")     List<String>    ambiguityFlags
    ) {
        public DetectedSpace {
            detectedFurnishings = detectedFurnishings == null ? List.of() : List.copyOf(detectedFurnishings);
            ambiguityFlags      = ambiguityFlags == null ? List.of() : List.copyOf(ambiguityFlags);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Furnishing(
            @JsonProperty("item_type")  String itemType,
            @JsonProperty("count")      int    count,
            @JsonProperty("confidence") double confidence
    ) {}
}
