package com.vistaplan.orchestrator.validation;

import com.vistaplan.orchestrator.validation.SpaceAnalysis.DetectedSpace;

import java.util.List;
import java.util.UUID;

/**
 * External judge that compares detected spaces with the user's free text.
 *
 * Implementations return findings in the shared failure taxonomy and throw
 * {@link com.vistaplan.orchestrator.judge.JudgeException} once their own
 * retries are spent.
 */
public interface SemanticJudge {

    Findings judge(Request request);

    record Request(
            UUID                             runId,
            int                              step,
            List<DetectedSpace>              spaces,
            String                           userRequest,
            String                           styleConstraints,
            List<String>                     expectedCategories,
            List<PolicyContext.ActiveRule>   policyRules
    ) {}

    record Findings(
            List<ComparisonFailure> failures,
            List<SuggestedFix>      fixes,
            String                  userRequestSummary,
            String                  modelUsed
    ) {
        public Findings {
            failures = failures == null ? List.of() : List.copyOf(failures);
            fixes    = fixes == null ? List.of() : List.copyOf(fixes);
        }
    }
}
