package com.vistaplan.orchestrator.generation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

/**
 * Body of POST /generate. Inputs travel by artifact id only.
 *
 * @param hardConstraints GUARD/LAW rule texts the output must respect
 * @param nudges          NUDGE/CHECK rule texts, given as soft guidance
 */
public record GenerationRequest(
        @JsonProperty("run_id")                  UUID         runId,
        @JsonProperty("step")                    int          step,
        @JsonProperty("service")                 String       service,
        @JsonProperty("attempt")                 int          attempt,
        @JsonProperty("input_artifact_ids")      List<String> inputArtifactIds,
        @JsonProperty("quality_tier")            String       qualityTier,
        @JsonProperty("corrective_instructions") String       correctiveInstructions,
        @JsonProperty("hard_constraints")        List<String> hardConstraints,
        @JsonProperty("nudges")                  List<String> nudges
) {}
