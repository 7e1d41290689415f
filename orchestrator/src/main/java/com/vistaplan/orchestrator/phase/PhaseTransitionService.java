package com.vistaplan.orchestrator.phase;

import com.vistaplan.orchestrator.model.Phase;
import com.vistaplan.orchestrator.model.PipelineRun;
import com.vistaplan.orchestrator.model.StepOutput;
import com.vistaplan.orchestrator.repository.PipelineRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * The only writer of a run's phase and step.
 *
 * Callers present the phase they believe the run is in. The write is a
 * conditional UPDATE on that phase, so two callers racing on the same run
 * cannot both advance it: the loser gets STALE_PHASE, or a no-op success if
 * the winner moved it exactly where the loser wanted it.
 *
 * The other run columns (paused, lastError, stepOutputs) are also written
 * here, each by its own column-level update.
 */
@Service
public class PhaseTransitionService {

    private static final Logger log = LoggerFactory.getLogger(PhaseTransitionService.class);

    private static final int MAX_OUTPUT_WRITES = 5;

    private final PipelineRunRepository    runRepo;
    private final ApplicationEventPublisher events;
    private final StepOutputCodec          outputCodec;
    private final Clock                    clock;

    public PhaseTransitionService(PipelineRunRepository runRepo,
                                  ApplicationEventPublisher events,
                                  StepOutputCodec outputCodec,
                                  Clock clock) {
        this.runRepo     = runRepo;
        this.events      = events;
        this.outputCodec = outputCodec;
        this.clock       = clock;
    }

    /**
     * Advance a run from {@code expected} to its successor.
     *
     * @param target optional; when given it must equal the successor of {@code expected}
     * @return the run as persisted after the call
     * @throws TransitionException ILLEGAL_TRANSITION, STALE_PHASE or RUN_NOT_FOUND
     */
    @Transactional
    public PipelineRun transition(UUID runId, Phase expected, Phase target) {
        PipelineRun run = runRepo.findById(runId).orElseThrow(() -> new TransitionException(
                TransitionException.Kind.RUN_NOT_FOUND, "Run not found: " + runId));

        Phase next = PhaseStateMachine.next(expected).orElseThrow(() -> new TransitionException(
                TransitionException.Kind.ILLEGAL_TRANSITION,
                "No transition out of final phase " + expected.wireName()));

        if (target != null && target != next) {
            throw new TransitionException(TransitionException.Kind.ILLEGAL_TRANSITION,
                    "%s -> %s is not a legal transition (expected %s)"
                            .formatted(expected.wireName(), target.wireName(), next.wireName()));
        }

        // Duplicate delivery of a transition that already happened.
        if (run.getPhase() == next) {
            log.debug("Run {} already at {}, transition is a no-op", runId, next.wireName());
            return run;
        }

        if (run.getPhase() != expected) {
            throw new TransitionException(TransitionException.Kind.STALE_PHASE,
                    "Run %s is at %s, caller expected %s"
                            .formatted(runId, run.getPhase().wireName(), expected.wireName()));
        }

        int updated = runRepo.compareAndSetPhase(runId, expected, next, next.step(), clock.instant());
        if (updated == 0) {
            // Lost a race between the read above and the conditional update.
            PipelineRun current = runRepo.findById(runId).orElseThrow();
            if (current.getPhase() == next) return current;
            throw new TransitionException(TransitionException.Kind.STALE_PHASE,
                    "Run %s moved to %s concurrently".formatted(runId, current.getPhase().wireName()));
        }

        log.info("Run {} phase {} -> {} (step {})", runId, expected.wireName(), next.wireName(), next.step());
        events.publishEvent(new RunPhaseChangedEvent(runId, expected, next, clock.instant()));
        run.applyCommittedPhase(next);
        return run;
    }

    /** Convenience for callers that only know the expected phase. */
    @Transactional
    public PipelineRun advance(UUID runId, Phase expected) {
        return transition(runId, expected, null);
    }

    // ------------------------------------------------------------------
    // Run bookkeeping
    // ------------------------------------------------------------------

    /** Stop dispatching new work for the run. In-flight attempts finish normally. */
    @Transactional
    public void pause(UUID runId) {
        requireUpdated(runId, runRepo.setPaused(runId, true, clock.instant()));
        log.info("Run {} paused", runId);
    }

    @Transactional
    public void resume(UUID runId) {
        requireUpdated(runId, runRepo.setPaused(runId, false, clock.instant()));
        log.info("Run {} resumed", runId);
    }

    @Transactional
    public void recordError(UUID runId, String error) {
        requireUpdated(runId, runRepo.setLastError(runId, error, clock.instant()));
    }

    /**
     * Store what a step produced. Concurrent sub-unit completions of the same
     * step retry the compare-and-set until their writes are all merged in.
     */
    @Transactional
    public void recordStepOutput(UUID runId, StepOutput output) {
        for (int attempt = 1; attempt <= MAX_OUTPUT_WRITES; attempt++) {
            PipelineRun run = runRepo.findById(runId).orElseThrow(() -> new TransitionException(
                    TransitionException.Kind.RUN_NOT_FOUND, "Run not found: " + runId));
            String current = run.getStepOutputs();
            String updated = outputCodec.withOutput(current, output);
            if (runRepo.compareAndSetStepOutputs(runId, current, updated, clock.instant()) == 1) {
                log.debug("Run {} step {} output recorded", runId, output.step());
                return;
            }
        }
        throw new IllegalStateException("Step-output document of run " + runId
                + " kept changing, gave up after " + MAX_OUTPUT_WRITES + " writes");
    }

    private static void requireUpdated(UUID runId, int rows) {
        if (rows == 0) {
            throw new TransitionException(TransitionException.Kind.RUN_NOT_FOUND, "Run not found: " + runId);
        }
    }
}
