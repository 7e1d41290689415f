package com.vistaplan.orchestrator.retry;

import com.vistaplan.orchestrator.validation.ComparisonFailure;
import com.vistaplan.orchestrator.validation.ComparisonVerdict;
import com.vistaplan.orchestrator.validation.FailureType;
import com.vistaplan.orchestrator.validation.FixTarget;
import com.vistaplan.orchestrator.validation.PolicyContext;
import com.vistaplan.orchestrator.validation.Severity;
import com.vistaplan.orchestrator.validation.SuggestedFix;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Builds the text handed to the generation service for the next attempt.
 *
 * The header hardens with each failed attempt. Below it: suggested fixes in
 * priority order, the high/critical failures, a fixed constraint for failure
 * types that have one, and every GUARD/LAW rule as a hard constraint.
 */
public final class CorrectiveInstructions {

    private static final Map<FailureType, String> TYPE_CONSTRAINTS = new EnumMap<>(FailureType.class);
    static {
        TYPE_CONSTRAINTS.put(FailureType.GEOMETRY_ERROR,
                "Preserve all wall angles exactly as shown. Do not straighten angled walls.");
        TYPE_CONSTRAINTS.put(FailureType.FURNITURE_MISMATCH,
                "Keep furniture at the exact scale and proportions of the floor plan dimensions.");
        TYPE_CONSTRAINTS.put(FailureType.STYLE_INCONSISTENCY,
                "Match the design style exactly as specified in the style reference.");
        TYPE_CONSTRAINTS.put(FailureType.MISSING_SPACE,
                "Every space in the floor plan must appear in the output.");
    }

    private CorrectiveInstructions() {}

    /** @param failedAttempt 1-based index of the attempt that just failed */
    public static String compose(int failedAttempt, ComparisonVerdict verdict, PolicyContext policy) {
        StringBuilder sb = new StringBuilder(header(failedAttempt)).append('\n');

        verdict.suggestedFixes().stream()
                .filter(f -> f.target() != FixTarget.MANUAL_REVIEW)
                .sorted(Comparator.comparingInt(SuggestedFix::priority))
                .forEach(f -> sb.append("- ").append(f.action()).append('\n'));

        Set<String> constraints = new LinkedHashSet<>();
        for (ComparisonFailure f : verdict.failures()) {
            if (f.severity() == Severity.CRITICAL || f.severity() == Severity.HIGH) {
                sb.append("- Fix ").append(f.type().wireName()).append(": ")
                  .append(f.description()).append('\n');
            }
            String fixed = TYPE_CONSTRAINTS.get(f.type());
            if (fixed != null) constraints.add(fixed);
        }
        policy.hardConstraints().forEach(r -> constraints.add(r.ruleText()));

        if (!constraints.isEmpty()) {
            sb.append("Hard constraints:\n");
            constraints.forEach(c -> sb.append("- ").append(c).append('\n'));
        }
        return sb.toString().trim();
    }

    static String header(int failedAttempt) {
        return switch (failedAttempt) {
            case 1  -> "The previous output did not pass review. Address the following:";
            case 2  -> "IMPORTANT: two attempts have failed review. Each item below must be fixed:";
            default -> "CRITICAL: this is a late attempt after repeated failures. Every item below is mandatory:";
        };
    }
}
