package com.vistaplan.orchestrator.validation;

import java.util.List;
import java.util.UUID;

/**
 * Result of validating one artifact. Immutable; failures keep the order the
 * stages produced them in, fixes are sorted by ascending priority.
 */
public record ComparisonVerdict(
        UUID                    runId,
        int                     stepId,
        boolean                 pass,
        String                  userRequestSummary,
        List<ComparisonFailure> failures,
        List<SuggestedFix>      suggestedFixes,
        NextStep                recommendedNextStep,
        long                    processingTimeMs,
        String                  modelUsed
) {
    public ComparisonVerdict {
        failures       = List.copyOf(failures);
        suggestedFixes = List.copyOf(suggestedFixes);
    }

    public long count(Severity severity) {
        return failures.stream().filter(f -> f.severity() == severity).count();
    }

    public boolean hasFailureOfType(FailureType type) {
        return failures.stream().anyMatch(f -> f.type() == type);
    }
}
