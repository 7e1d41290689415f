package com.vistaplan.orchestrator.retry;

import com.vistaplan.orchestrator.config.PipelineProperties;
import com.vistaplan.orchestrator.model.PipelineJob;
import com.vistaplan.orchestrator.validation.ComparisonFailure;
import com.vistaplan.orchestrator.validation.ComparisonVerdict;
import com.vistaplan.orchestrator.validation.NextStep;
import com.vistaplan.orchestrator.validation.PolicyContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Decides what a job does next once its attempt has a verdict.
 *
 * <pre>
 *   PROCEED          → complete
 *   BLOCK_FOR_HUMAN  → block, with the reason chain
 *   RETRY            → back to PENDING after an exponential back-off,
 *                      unless the job or the run has spent its budget,
 *                      in which case block and surface the best attempt
 * </pre>
 * A blocked job is never retried automatically; only a human decision moves it on.
 */
@Component
public class RetryOrchestrator {

    private final PipelineProperties props;
    private final Clock              clock;

    public RetryOrchestrator(PipelineProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
    }

    /**
     * @param job         the job whose attempt was just judged; attempts already counts it
     * @param runAttempts attempts spent across the whole run, this one included
     * @param history     every attempt of this job so far, this one included
     */
    public RetryDecision decide(PipelineJob job, ComparisonVerdict verdict, int runAttempts,
                                PolicyContext policy, List<AttemptSummary> history) {
        NextStep next = verdict.recommendedNextStep();
        if (next == NextStep.PROCEED) {
            return RetryDecision.proceed("passed on attempt " + job.getAttempts());
        }
        if (next == NextStep.BLOCK_FOR_HUMAN) {
            return block(verdict, history, "validation requires human review");
        }

        if (job.getAttempts() >= job.getMaxAttempts()) {
            return block(verdict, history,
                    "job budget spent (" + job.getAttempts() + "/" + job.getMaxAttempts() + " attempts)");
        }
        if (runAttempts >= props.maxAttemptsPerRun()) {
            return block(verdict, history,
                    "run budget spent (" + runAttempts + "/" + props.maxAttemptsPerRun() + " attempts)");
        }

        Duration delay = backoff(job.getAttempts());
        return RetryDecision.retry(
                clock.instant().plus(delay),
                CorrectiveInstructions.compose(job.getAttempts(), verdict, policy),
                "retry " + (job.getAttempts() + 1) + "/" + job.getMaxAttempts() + " in " + delay.toSeconds() + "s");
    }

    /** base · 2^(n-1), capped. n is the number of attempts already made. */
    Duration backoff(int attemptsMade) {
        int exponent = Math.max(0, Math.min(attemptsMade - 1, 20));
        Duration delay = props.retryBaseDelay().multipliedBy(1L << exponent);
        return delay.compareTo(props.retryMaxDelay()) > 0 ? props.retryMaxDelay() : delay;
    }

    private RetryDecision block(ComparisonVerdict verdict, List<AttemptSummary> history, String why) {
        UUID best = BestAttemptSelector.select(history).map(AttemptSummary::artifactId).orElse(null);
        return RetryDecision.blocked(best, reasonChain(why, verdict, history));
    }

    static String reasonChain(String why, ComparisonVerdict verdict, List<AttemptSummary> history) {
        StringBuilder sb = new StringBuilder("Blocked: ").append(why).append('\n');
        for (AttemptSummary a : history) {
            sb.append("attempt ").append(a.attempt()).append(": ")
              .append(a.criticalCount()).append(" critical, ")
              .append(a.highCount()).append(" high, ")
              .append(a.failureCount()).append(" total\n");
        }
        for (ComparisonFailure f : verdict.failures()) {
            sb.append("[").append(f.severity().wireName()).append("] ")
              .append(f.type().wireName()).append(": ").append(f.description()).append('\n');
        }
        verdict.suggestedFixes().forEach(f ->
                sb.append("fix (p").append(f.priority()).append("): ").append(f.action()).append('\n'));
        return sb.toString().trim();
    }
}
