package com.vistaplan.orchestrator.retry;

import com.vistaplan.orchestrator.model.VerdictRecord;

import java.util.UUID;

/** Severity counts of one finished attempt, enough to rank attempts against each other. */
public record AttemptSummary(
        UUID verdictId,
        UUID artifactId,
        int  attempt,
        int  criticalCount,
        int  highCount,
        int  failureCount
) {
    public static AttemptSummary of(VerdictRecord r) {
        return new AttemptSummary(r.getId(), r.getArtifactId(), r.getAttempt(),
                r.getCriticalCount(), r.getHighCount(), r.getFailureCount());
    }
}
