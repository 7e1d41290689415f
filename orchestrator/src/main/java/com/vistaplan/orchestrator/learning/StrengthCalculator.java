package com.vistaplan.orchestrator.learning;

import com.vistaplan.orchestrator.model.StrengthStage;

/**
 * Strength and confidence rules.
 *
 * Confidence is rejections caused / times triggered, and only counts once a
 * rule has triggered at least 5 times (1.0 before that). A rule whose
 * confidence is measured below 0.70 is capped at NUDGE for good.
 */
public final class StrengthCalculator {

    public static final int    CHECK_AT_VIOLATIONS = 3;
    public static final int    GUARD_AT_VIOLATIONS = 6;
    public static final double MIN_CONFIDENCE      = 0.70;
    public static final int    MIN_SAMPLES         = 5;

    private StrengthCalculator() {}

    public static double confidence(int triggeredCount, int rejectedDueToTrigger) {
        if (triggeredCount < MIN_SAMPLES) return 1.0;
        double c = (double) rejectedDueToTrigger / triggeredCount;
        return Math.max(0.0, Math.min(1.0, c));
    }

    /** True once enough samples exist and they say the rule is unreliable. */
    public static boolean belowConfidenceFloor(int triggeredCount, double confidence) {
        return triggeredCount >= MIN_SAMPLES && confidence < MIN_CONFIDENCE;
    }

    /** Stage earned by count alone. LAW is never earned this way. */
    public static StrengthStage stageForViolations(int violationCount) {
        if (violationCount >= GUARD_AT_VIOLATIONS) return StrengthStage.GUARD;
        if (violationCount >= CHECK_AT_VIOLATIONS) return StrengthStage.CHECK;
        return StrengthStage.NUDGE;
    }

    /**
     * Stage after a new violation. Never lowers the current stage, except
     * that a capped rule is always NUDGE.
     */
    public static StrengthStage afterViolation(StrengthStage current, int violationCount, boolean capped) {
        if (capped) return StrengthStage.NUDGE;
        StrengthStage earned = stageForViolations(violationCount);
        return earned.compareTo(current) > 0 ? earned : current;
    }

    public static boolean canPromoteToLaw(boolean capped, boolean disabled) {
        return !capped && !disabled;
    }
}
