package com.vistaplan.orchestrator.retry;

import com.vistaplan.orchestrator.config.PipelineProperties;
import com.vistaplan.orchestrator.model.PipelineJob;
import com.vistaplan.orchestrator.validation.ComparisonFailure;
import com.vistaplan.orchestrator.validation.ComparisonVerdict;
import com.vistaplan.orchestrator.validation.FailureType;
import com.vistaplan.orchestrator.validation.FixTarget;
import com.vistaplan.orchestrator.validation.NextStep;
import com.vistaplan.orchestrator.validation.PolicyContext;
import com.vistaplan.orchestrator.validation.Severity;
import com.vistaplan.orchestrator.validation.SuggestedFix;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RetryOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final UUID    RUN = UUID.randomUUID();

    private final RetryOrchestrator orchestrator =
            new RetryOrchestrator(PipelineProperties.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

    private static final ComparisonFailure ANGLED_WALL = ComparisonFailure.of(
            FailureType.GEOMETRY_ERROR, Severity.HIGH, "Angled wall in living room was straightened");

    // -------------------------------------------------------------------------
    // decide
    // -------------------------------------------------------------------------

    @Test
    void decide_proceed_completes() {
        RetryDecision d = orchestrator.decide(job(1), verdict(NextStep.PROCEED), 1, PolicyContext.empty(), List.of());

        assertThat(d.outcome()).isEqualTo(RetryDecision.Outcome.PROCEED);
        assertThat(d.reason()).isEqualTo("passed on attempt 1");
    }

    @Test
    void decide_firstRetry_backsOffTwoSecondsWithInstructions() {
        RetryDecision d = orchestrator.decide(job(1), verdict(NextStep.RETRY, ANGLED_WALL), 1,
                PolicyContext.empty(), List.of());

        assertThat(d.outcome()).isEqualTo(RetryDecision.Outcome.RETRY);
        assertThat(d.notBefore()).isEqualTo(NOW.plusSeconds(2));
        assertThat(d.correctiveInstructions())
                .startsWith("The previous output did not pass review.")
                .contains("Fix geometry_error: Angled wall in living room was straightened")
                .contains("Preserve all wall angles exactly as shown.");
        assertThat(d.reason()).isEqualTo("retry 2/3 in 2s");
    }

    @Test
    void decide_jobBudgetSpent_blocksWithBestAttempt() {
        UUID first  = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        List<AttemptSummary> history = List.of(
                new AttemptSummary(UUID.randomUUID(), first, 1, 0, 2, 3),
                new AttemptSummary(UUID.randomUUID(), second, 2, 0, 1, 4),
                new AttemptSummary(UUID.randomUUID(), UUID.randomUUID(), 3, 1, 0, 1));

        RetryDecision d = orchestrator.decide(job(3), verdict(NextStep.RETRY, ANGLED_WALL), 3,
                PolicyContext.empty(), history);

        assertThat(d.outcome()).isEqualTo(RetryDecision.Outcome.BLOCKED);
        assertThat(d.bestArtifactId()).isEqualTo(second);
        assertThat(d.reason())
                .startsWith("Blocked: job budget spent (3/3 attempts)")
                .contains("attempt 3: 1 critical, 0 high, 1 total")
                .contains("[high] geometry_error: Angled wall");
    }

    @Test
    void decide_runBudgetSpent_blocksEvenWithJobAttemptsLeft() {
        RetryDecision d = orchestrator.decide(job(1), verdict(NextStep.RETRY, ANGLED_WALL), 20,
                PolicyContext.empty(), List.of());

        assertThat(d.outcome()).isEqualTo(RetryDecision.Outcome.BLOCKED);
        assertThat(d.reason()).startsWith("Blocked: run budget spent (20/20 attempts)");
        assertThat(d.bestArtifactId()).isNull();
    }

    @Test
    void decide_blockForHuman_neverRetried() {
        RetryDecision d = orchestrator.decide(job(1), verdict(NextStep.BLOCK_FOR_HUMAN), 1,
                PolicyContext.empty(), List.of());

        assertThat(d.outcome()).isEqualTo(RetryDecision.Outcome.BLOCKED);
        assertThat(d.reason()).startsWith("Blocked: validation requires human review");
        assertThat(d.notBefore()).isNull();
    }

    // -------------------------------------------------------------------------
    // backoff
    // -------------------------------------------------------------------------

    @Test
    void backoff_doublesAndCapsAtThirtySeconds() {
        assertThat(orchestrator.backoff(1)).isEqualTo(Duration.ofSeconds(2));
        assertThat(orchestrator.backoff(2)).isEqualTo(Duration.ofSeconds(4));
        assertThat(orchestrator.backoff(4)).isEqualTo(Duration.ofSeconds(16));
        assertThat(orchestrator.backoff(5)).isEqualTo(Duration.ofSeconds(30));
        assertThat(orchestrator.backoff(40)).isEqualTo(Duration.ofSeconds(30));
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static PipelineJob job(int attemptsMade) {
        PipelineJob job = new PipelineJob(RUN, 3, "staging", "run:3:staging", 3);
        for (int i = 0; i < attemptsMade; i++) job.incrementAttempts();
        return job;
    }

    private static ComparisonVerdict verdict(NextStep next, ComparisonFailure... failures) {
        List<SuggestedFix> fixes = failures.length == 0
                ? List.of()
                : List.of(new SuggestedFix(FixTarget.PROMPT, "Keep the angled wall", "geometry matches", 1));
        return new ComparisonVerdict(RUN, 3, next == NextStep.PROCEED, "Open-plan living room",
                List.of(failures), fixes, next, 80L, "judge-model");
    }
}
