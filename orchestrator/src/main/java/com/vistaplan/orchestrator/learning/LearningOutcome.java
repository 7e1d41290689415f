package com.vistaplan.orchestrator.learning;

import java.util.List;
import java.util.UUID;

/**
 * What recording one verdict did to the rule base.
 *
 * @param triggeredRuleIds existing rules the verdict's failures matched
 * @param createdRuleIds   rules created by this verdict, at any scope
 */
public record LearningOutcome(List<UUID> triggeredRuleIds, List<UUID> createdRuleIds) {

    public LearningOutcome {
        triggeredRuleIds = List.copyOf(triggeredRuleIds);
        createdRuleIds   = List.copyOf(createdRuleIds);
    }

    public static LearningOutcome nothing() {
        return new LearningOutcome(List.of(), List.of());
    }
}
