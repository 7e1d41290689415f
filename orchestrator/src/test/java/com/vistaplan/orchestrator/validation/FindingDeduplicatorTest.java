package com.vistaplan.orchestrator.validation;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FindingDeduplicatorTest {

    @Test
    void failureRepeatingBatteryFinding_isDropped() {
        var existing = List.of(ComparisonFailure.of(FailureType.MISSING_SPACE, Severity.HIGH,
                "Expected room types not detected: kitchen"));
        var judged = List.of(
                ComparisonFailure.of(FailureType.MISSING_SPACE, Severity.HIGH,
                        "EXPECTED ROOM TYPES NOT DETECTED: kitchen, pantry"),
                ComparisonFailure.of(FailureType.STYLE_INCONSISTENCY, Severity.MEDIUM,
                        "Floors are dark walnut, user asked for light oak"));

        assertThat(FindingDeduplicator.newFailures(existing, judged))
                .extracting(ComparisonFailure::type)
                .containsExactly(FailureType.STYLE_INCONSISTENCY);
    }

    @Test
    void sameDescriptionDifferentType_isKept() {
        var existing = List.of(ComparisonFailure.of(FailureType.MISSING_SPACE, Severity.HIGH, "Balcony"));
        var judged = List.of(ComparisonFailure.of(FailureType.GEOMETRY_ERROR, Severity.HIGH, "Balcony"));

        assertThat(FindingDeduplicator.newFailures(existing, judged)).hasSize(1);
    }

    @Test
    void judgeRepeatingItself_keepsFirst() {
        var judged = List.of(
                ComparisonFailure.of(FailureType.GEOMETRY_ERROR, Severity.HIGH, "Wall between kitchen and hall missing"),
                ComparisonFailure.of(FailureType.GEOMETRY_ERROR, Severity.HIGH, "Wall between kitchen and hall missing again"));

        assertThat(FindingDeduplicator.newFailures(List.of(), judged)).hasSize(1);
    }

    @Test
    void fixWithSameTargetAndActionPrefix_isDropped() {
        var existing = List.of(new SuggestedFix(FixTarget.PROMPT, "Look specifically for: kitchen", "x", 2));
        var judged = List.of(
                new SuggestedFix(FixTarget.PROMPT, "look specifically for: kitchen", "y", 3),
                new SuggestedFix(FixTarget.INPUT, "Look specifically for: kitchen", "z", 3));

        assertThat(FindingDeduplicator.newFixes(existing, judged))
                .extracting(SuggestedFix::target)
                .containsExactly(FixTarget.INPUT);
    }

    @Test
    void fixWhoseActionIsContainedInAnExistingOne_isDropped() {
        var existing = List.of(new SuggestedFix(FixTarget.PROMPT,
                "Detect exactly 4 spaces; include small rooms such as storage and WC", "x", 2));
        var judged = List.of(
                new SuggestedFix(FixTarget.PROMPT, "include small rooms such as storage cupboards", "y", 3),
                new SuggestedFix(FixTarget.PROMPT, "Render the kitchen island in oak", "z", 4));

        assertThat(FindingDeduplicator.newFixes(existing, judged))
                .extracting(SuggestedFix::action)
                .containsExactly("Render the kitchen island in oak");
    }
}
