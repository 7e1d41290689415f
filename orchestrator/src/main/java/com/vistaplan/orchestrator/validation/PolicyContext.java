package com.vistaplan.orchestrator.validation;

import com.vistaplan.orchestrator.model.StrengthStage;

import java.util.List;
import java.util.UUID;

/**
 * Learned rules that apply to the artifact under validation, already decayed
 * and filtered (no disabled or muted rules).
 */
public record PolicyContext(List<ActiveRule> rules) {

    public record ActiveRule(UUID ruleId, String category, String ruleText, StrengthStage stage) {}

    public PolicyContext {
        rules = List.copyOf(rules);
    }

    public static PolicyContext empty() {
        return new PolicyContext(List.of());
    }

    /** GUARD and LAW rules: hard constraints for corrective instructions. */
    public List<ActiveRule> hardConstraints() {
        return rules.stream().filter(r -> r.stage().atLeast(StrengthStage.GUARD)).toList();
    }
}
