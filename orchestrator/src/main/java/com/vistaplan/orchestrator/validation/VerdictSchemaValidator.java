package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Output-side schema check: nothing leaves the engine unless it fits
 * {@code schemas/comparison-verdict.schema.json}.
 *
 * Over-long strings are truncated and priorities clamped first, since those
 * come from the judge and are harmless to trim. Anything still wrong after
 * that replaces the verdict with a block-for-human fallback.
 */
public class VerdictSchemaValidator {

    static final int MAX_DESCRIPTION     = 500;
    static final int MAX_ACTION          = 500;
    static final int MAX_EXPECTED_EFFECT = 300;
    static final int MAX_SUMMARY         = 1000;

    static final String SCHEMA = "comparison-verdict.schema.json";

    private final JsonSchema   schema = SchemaResources.load(SCHEMA);
    private final ObjectMapper json;

    public VerdictSchemaValidator(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public ComparisonVerdict sanitize(ComparisonVerdict v) {
        List<ComparisonFailure> failures = v.failures().stream()
                .map(f -> new ComparisonFailure(f.type(), truncate(f.description(), MAX_DESCRIPTION),
                        f.severity(), f.affectedSpaceId(), f.expected(), f.actual()))
                .toList();
        List<SuggestedFix> fixes = v.suggestedFixes().stream()
                .map(x -> new SuggestedFix(x.target(), truncate(x.action(), MAX_ACTION),
                        truncate(x.expectedEffect(), MAX_EXPECTED_EFFECT),
                        Math.max(1, Math.min(10, x.priority()))))
                .sorted(Comparator.comparingInt(SuggestedFix::priority))
                .toList();
        return new ComparisonVerdict(v.runId(), v.stepId(), v.pass(),
                truncate(v.userRequestSummary(), MAX_SUMMARY), failures, fixes,
                v.recommendedNextStep(), v.processingTimeMs(), v.modelUsed());
    }

    public List<String> validate(ComparisonVerdict v) {
        List<String> errors = new ArrayList<>(SchemaResources.messages(schema.validate(json.valueToTree(v))));
        // Ordering is not expressible in the schema.
        for (int i = 1; i < v.suggestedFixes().size(); i++) {
            if (v.suggestedFixes().get(i - 1).priority() > v.suggestedFixes().get(i).priority()) {
                errors.add("$.suggestedFixes: not sorted by priority");
                break;
            }
        }
        return errors;
    }

    /** Verdict returned when the engine's own output failed validation. */
    public static ComparisonVerdict fallback(ComparisonVerdict broken, List<String> errors) {
        String detail = String.join("; ", errors);
        return new ComparisonVerdict(
                broken.runId(),
                Math.max(0, broken.stepId()),
                false,
                "Verdict could not be produced in a valid form; a reviewer must inspect this artifact.",
                List.of(ComparisonFailure.of(FailureType.SCHEMA_INVALID, Severity.CRITICAL,
                        truncate("Verdict failed self-validation: " + detail, MAX_DESCRIPTION))),
                List.of(new SuggestedFix(FixTarget.MANUAL_REVIEW,
                        "Review the artifact manually", "A human decides whether to proceed", 1)),
                NextStep.BLOCK_FOR_HUMAN,
                Math.max(0, broken.processingTimeMs()),
                blank(broken.modelUsed()) ? "rules-only" : broken.modelUsed());
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) return s;
        return s.substring(0, max - 1) + "…";
    }
}
