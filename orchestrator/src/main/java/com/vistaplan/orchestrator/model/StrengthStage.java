package com.vistaplan.orchestrator.model;

/**
 * Escalation level of a learned rule. Declaration order is the strength order.
 *
 * NUDGE  → soft hint in the generation prompt
 * CHECK  → evaluated by the judge, a violation is reported
 * GUARD  → hard constraint in corrective instructions
 * LAW    → only reachable by manual promotion
 */
public enum StrengthStage {
    NUDGE,
    CHECK,
    GUARD,
    LAW;

    public boolean atLeast(StrengthStage other) {
        return compareTo(other) >= 0;
    }

    public StrengthStage oneBelow() {
        return this == NUDGE ? NUDGE : values()[ordinal() - 1];
    }
}
