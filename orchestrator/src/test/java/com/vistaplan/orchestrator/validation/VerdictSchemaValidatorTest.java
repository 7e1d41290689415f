package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VerdictSchemaValidatorTest {

    final VerdictSchemaValidator validator = new VerdictSchemaValidator(new ObjectMapper());

    @Test
    void sanitize_truncatesAndClampsAndSorts() {
        ComparisonVerdict raw = verdict(true, NextStep.PROCEED,
                List.of(ComparisonFailure.of(FailureType.STYLE_INCONSISTENCY, Severity.LOW, "d".repeat(800))),
                List.of(new SuggestedFix(FixTarget.PROMPT, "second", "e", 14),
                        new SuggestedFix(FixTarget.PROMPT, "first", "e", 0)));

        ComparisonVerdict clean = validator.sanitize(raw);

        assertThat(clean.failures().get(0).description()).hasSize(500).endsWith("…");
        assertThat(clean.suggestedFixes()).extracting(SuggestedFix::priority).containsExactly(1, 10);
        assertThat(clean.suggestedFixes().get(0).action()).isEqualTo("first");
        assertThat(validator.validate(clean)).isEmpty();
    }

    @Test
    void validate_passMustMatchProceed() {
        ComparisonVerdict v = verdict(true, NextStep.RETRY, List.of(), List.of());

        assertThat(validator.validate(v)).singleElement().asString().contains("pass");
    }

    @Test
    void validate_missingSummaryAndModel_areReported() {
        ComparisonVerdict v = new ComparisonVerdict(Analyses.RUN, 2, true, " ", List.of(), List.of(),
                NextStep.PROCEED, 10, null);

        List<String> errors = validator.validate(v);

        assertThat(errors).hasSize(2);
        assertThat(errors).anySatisfy(e -> assertThat(e).contains("userRequestSummary"));
        assertThat(errors).anySatisfy(e -> assertThat(e).contains("modelUsed"));
    }

    @Test
    void validate_failureWithoutTypeOrSeverity_isReported() {
        ComparisonVerdict v = verdict(false, NextStep.RETRY,
                List.of(new ComparisonFailure(null, "something off", null, null, null, null)), List.of());

        List<String> errors = validator.validate(v);

        assertThat(errors).hasSize(2).allSatisfy(e -> assertThat(e).contains("failures[0]"));
    }

    @Test
    void validate_unsortedFixes_areReported() {
        ComparisonVerdict v = verdict(false, NextStep.RETRY, List.of(),
                List.of(new SuggestedFix(FixTarget.PROMPT, "later", null, 5),
                        new SuggestedFix(FixTarget.INPUT, "sooner", null, 2)));

        assertThat(validator.validate(v)).singleElement().asString().contains("not sorted");
    }

    @Test
    void fallback_isAValidBlockingVerdict() {
        ComparisonVerdict broken = new ComparisonVerdict(Analyses.RUN, -1, true, null, List.of(), List.of(),
                NextStep.RETRY, -5, "");

        ComparisonVerdict fallback = VerdictSchemaValidator.fallback(broken, validator.validate(broken));

        assertThat(fallback.recommendedNextStep()).isEqualTo(NextStep.BLOCK_FOR_HUMAN);
        assertThat(fallback.pass()).isFalse();
        assertThat(fallback.failures()).singleElement().satisfies(f -> {
            assertThat(f.type()).isEqualTo(FailureType.SCHEMA_INVALID);
            assertThat(f.severity()).isEqualTo(Severity.CRITICAL);
        });
        assertThat(validator.validate(fallback)).isEmpty();
    }

    private static ComparisonVerdict verdict(boolean pass, NextStep next,
                                             List<ComparisonFailure> failures, List<SuggestedFix> fixes) {
        return new ComparisonVerdict(Analyses.RUN, 2, pass, "Warm Scandinavian living room",
                failures, fixes, next, 40, "rules-only");
    }
}
