package com.vistaplan.orchestrator.learning;

import com.vistaplan.orchestrator.validation.ComparisonFailure;
import com.vistaplan.orchestrator.validation.FailureType;
import com.vistaplan.orchestrator.validation.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleKeysTest {

    @Test
    void keyFor_normalizesDigitsCaseAndPunctuation() {
        ComparisonFailure a = ComparisonFailure.of(FailureType.FURNITURE_MISMATCH, Severity.HIGH,
                "Bedroom 2 has no bed!");
        ComparisonFailure b = ComparisonFailure.of(FailureType.FURNITURE_MISMATCH, Severity.MEDIUM,
                "bedroom 14 has NO bed");

        assertThat(RuleKeys.keyFor(3, a)).isEqualTo("3:furniture_mismatch:bedroom # has no bed");
        assertThat(RuleKeys.keyFor(3, a)).isEqualTo(RuleKeys.keyFor(3, b));
    }

    @Test
    void keyFor_stepAndType_partOfIdentity() {
        ComparisonFailure f = ComparisonFailure.of(FailureType.MISSING_SPACE, Severity.HIGH, "kitchen missing");
        ComparisonFailure g = ComparisonFailure.of(FailureType.EXTRA_SPACE, Severity.HIGH, "kitchen missing");

        assertThat(RuleKeys.keyFor(3, f)).isNotEqualTo(RuleKeys.keyFor(5, f));
        assertThat(RuleKeys.keyFor(3, f)).isNotEqualTo(RuleKeys.keyFor(3, g));
    }

    @Test
    void normalize_longDescription_truncated() {
        String longText = "a ".repeat(100);

        assertThat(RuleKeys.normalize(longText)).hasSizeLessThanOrEqualTo(RuleKeys.MAX_DESCRIPTION);
        assertThat(RuleKeys.normalize(null)).isEmpty();
    }

    @Test
    void ruleTextFor_nullDescription_fallsBackToType() {
        ComparisonFailure f = ComparisonFailure.of(FailureType.GEOMETRY_ERROR, Severity.LOW, null);

        assertThat(RuleKeys.ruleTextFor(f)).isEqualTo("Avoid: geometry_error");
    }

    @Test
    void conditions_emptyMatchesEverything_categoryMatchesOnlyWhenPresent() {
        assertThat(RuleConditions.always().matches(List.of())).isTrue();
        assertThat(RuleConditions.forCategory("bedroom").matches(List.of("kitchen", "bedroom"))).isTrue();
        assertThat(RuleConditions.forCategory("bedroom").matches(List.of("kitchen"))).isFalse();
    }
}
