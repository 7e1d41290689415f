package com.vistaplan.orchestrator.validation;

import java.util.ArrayList;
import java.util.List;

/** Failures and fixes accumulated by one validation stage. */
public final class StageFindings {

    private final List<ComparisonFailure> failures = new ArrayList<>();
    private final List<SuggestedFix>      fixes    = new ArrayList<>();

    public void fail(ComparisonFailure failure, SuggestedFix fix) {
        failures.add(failure);
        if (fix != null) fixes.add(fix);
    }

    public void addAll(List<ComparisonFailure> moreFailures, List<SuggestedFix> moreFixes) {
        failures.addAll(moreFailures);
        fixes.addAll(moreFixes);
    }

    public List<ComparisonFailure> failures() { return failures; }
    public List<SuggestedFix>      fixes()    { return fixes; }
}
