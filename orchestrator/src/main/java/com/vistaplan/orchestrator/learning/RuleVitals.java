package com.vistaplan.orchestrator.learning;

import com.vistaplan.orchestrator.model.PolicyRule;
import com.vistaplan.orchestrator.model.StrengthStage;

import java.time.Instant;

/** The part of a rule that decay reads and writes. */
public record RuleVitals(
        StrengthStage stage,
        int           health,
        boolean       disabled,
        boolean       locked,
        boolean       muted,
        Instant       lastDecayAt
) {
    public static RuleVitals of(PolicyRule r) {
        return new RuleVitals(r.getStrengthStage(), r.getHealth(), r.isDisabled(),
                r.isLocked(), r.isMuted(), r.getLastHealthDecayAt());
    }

    public void applyTo(PolicyRule r) {
        r.setStrengthStage(stage);
        r.setHealth(health);
        r.setDisabled(disabled);
        r.setLastHealthDecayAt(lastDecayAt);
    }

    RuleVitals withHealth(int h)              { return new RuleVitals(stage, h, disabled, locked, muted, lastDecayAt); }
    RuleVitals withStage(StrengthStage s)     { return new RuleVitals(s, health, disabled, locked, muted, lastDecayAt); }
    RuleVitals withDisabled(boolean d)        { return new RuleVitals(stage, health, d, locked, muted, lastDecayAt); }
    RuleVitals withLastDecayAt(Instant t)     { return new RuleVitals(stage, health, disabled, locked, muted, t); }
}
