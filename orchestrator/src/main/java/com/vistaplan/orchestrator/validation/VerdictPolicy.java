package com.vistaplan.orchestrator.validation;

import java.util.List;

/**
 * Fixed decision thresholds, evaluated in order:
 * <ol>
 *   <li>any critical failure → block for a human</li>
 *   <li>more than 5 failures → block for a human</li>
 *   <li>any high failure → retry (more than 2 high ones is reported the same way)</li>
 *   <li>otherwise → pass and proceed</li>
 * </ol>
 */
public final class VerdictPolicy {

    static final int MAX_FAILURES_BEFORE_BLOCK = 5;
    static final int MANY_HIGH                 = 2;

    public record Decision(boolean pass, NextStep nextStep, String reason) {}

    private VerdictPolicy() {}

    public static Decision decide(List<ComparisonFailure> failures) {
        long critical = failures.stream().filter(f -> f.severity() == Severity.CRITICAL).count();
        long high     = failures.stream().filter(f -> f.severity() == Severity.HIGH).count();

        if (critical > 0) {
            return new Decision(false, NextStep.BLOCK_FOR_HUMAN, critical + " critical failure(s)");
        }
        if (failures.size() > MAX_FAILURES_BEFORE_BLOCK) {
            return new Decision(false, NextStep.BLOCK_FOR_HUMAN,
                    failures.size() + " failures exceed the ceiling of " + MAX_FAILURES_BEFORE_BLOCK);
        }
        if (high > MANY_HIGH) {
            return new Decision(false, NextStep.RETRY, high + " high-severity failures");
        }
        if (high > 0) {
            return new Decision(false, NextStep.RETRY, "high-severity failure present");
        }
        return new Decision(true, NextStep.PROCEED, "only low/medium findings");
    }
}
