package com.vistaplan.orchestrator.learning;

import com.vistaplan.orchestrator.validation.ComparisonVerdict;

import java.util.Map;
import java.util.UUID;

/**
 * One validated attempt, as the learning side needs to see it.
 *
 * @param categoriesBySpaceId categories of the spaces the artifact contains,
 *                            used to scope new rules and to match conditions
 */
public record LearningInput(
        UUID                runId,
        String              ownerId,
        int                 step,
        ComparisonVerdict   verdict,
        Map<String, String> categoriesBySpaceId
) {
    public LearningInput {
        categoriesBySpaceId = categoriesBySpaceId == null ? Map.of() : Map.copyOf(categoriesBySpaceId);
    }
}
