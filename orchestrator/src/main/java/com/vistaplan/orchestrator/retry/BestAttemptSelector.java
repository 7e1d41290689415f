package com.vistaplan.orchestrator.retry;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the attempt to show a human when a job is blocked: fewest critical
 * failures, then fewest high, then fewest overall. On a tie the later attempt
 * wins, since it was generated with more corrective guidance.
 */
public final class BestAttemptSelector {

    static final Comparator<AttemptSummary> BEST_FIRST = Comparator
            .comparingInt(AttemptSummary::criticalCount)
            .thenComparingInt(AttemptSummary::highCount)
            .thenComparingInt(AttemptSummary::failureCount)
            .thenComparing(Comparator.comparingInt(AttemptSummary::attempt).reversed());

    private BestAttemptSelector() {}

    public static Optional<AttemptSummary> select(List<AttemptSummary> attempts) {
        return attempts.stream().min(BEST_FIRST);
    }
}
