package com.vistaplan.orchestrator.generation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Response of POST /generate.
 *
 * @param kind     ArtifactKind name, e.g. "IMAGE"
 * @param analysis space-analysis document, present for analysis/detection steps
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerationResult(
        @JsonProperty("kind")        String   kind,
        @JsonProperty("storage_ref") String   storageRef,
        @JsonProperty("width")       Integer  width,
        @JsonProperty("height")      Integer  height,
        @JsonProperty("sha256")      String   sha256,
        @JsonProperty("model")       String   model,
        @JsonProperty("analysis")    JsonNode analysis
) {}
