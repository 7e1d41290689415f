package com.vistaplan.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.generation.GenerationClient;
import com.vistaplan.orchestrator.generation.GenerationException;
import com.vistaplan.orchestrator.generation.GenerationRequest;
import com.vistaplan.orchestrator.generation.GenerationResult;
import com.vistaplan.orchestrator.judge.JudgeException;
import com.vistaplan.orchestrator.learning.ProgressiveLearningService;
import com.vistaplan.orchestrator.ledger.JobLedger;
import com.vistaplan.orchestrator.ledger.JobNotFoundException;
import com.vistaplan.orchestrator.ledger.JobRelease;
import com.vistaplan.orchestrator.ledger.LockLostException;
import com.vistaplan.orchestrator.ledger.LockToken;
import com.vistaplan.orchestrator.model.Artifact;
import com.vistaplan.orchestrator.model.ArtifactKind;
import com.vistaplan.orchestrator.model.JobStatus;
import com.vistaplan.orchestrator.model.Phase;
import com.vistaplan.orchestrator.model.PipelineJob;
import com.vistaplan.orchestrator.model.PipelineRun;
import com.vistaplan.orchestrator.model.QualityTier;
import com.vistaplan.orchestrator.model.StepOutput;
import com.vistaplan.orchestrator.phase.PhaseStateMachine;
import com.vistaplan.orchestrator.phase.PhaseTransitionService;
import com.vistaplan.orchestrator.phase.StepOutputCodec;
import com.vistaplan.orchestrator.phase.TransitionException;
import com.vistaplan.orchestrator.repository.ArtifactRepository;
import com.vistaplan.orchestrator.repository.PipelineJobRepository;
import com.vistaplan.orchestrator.repository.PipelineRunRepository;
import com.vistaplan.orchestrator.retry.RetryDecision;
import com.vistaplan.orchestrator.validation.ArtifactUnderReview;
import com.vistaplan.orchestrator.validation.ComparisonVerdict;
import com.vistaplan.orchestrator.validation.PolicyContext;
import com.vistaplan.orchestrator.validation.ValidationEngine;
import com.vistaplan.orchestrator.validation.ValidationExpectations;
import com.vistaplan.orchestrator.validation.ValidationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Executes one attempt of a locked job:
 *
 *  1. Move the run into the step's working phase (first attempt only)
 *  2. Assemble the policy context (applies lazy decay)
 *  3. Call the generation service
 *  4. Persist the artifact and extend the lock
 *  5. Validate, then hand off to {@link VerdictProcessor}
 *
 * Every exit path releases the lock, except a persistence failure: that
 * propagates, and the lock's TTL hands the job to the next worker.
 */
@Component
public class AttemptRunner {

    private static final Logger log = LoggerFactory.getLogger(AttemptRunner.class);

    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {};

    private final PipelineRunRepository      runRepo;
    private final PipelineJobRepository      jobRepo;
    private final ArtifactRepository         artifactRepo;
    private final PhaseTransitionService     transitions;
    private final ProgressiveLearningService learning;
    private final GenerationClient           generation;
    private final ValidationEngine           validation;
    private final VerdictProcessor           verdicts;
    private final JobLedger                  ledger;
    private final StepOutputCodec            outputCodec;
    private final ObjectMapper               json;

    public AttemptRunner(PipelineRunRepository runRepo,
                         PipelineJobRepository jobRepo,
                         ArtifactRepository artifactRepo,
                         PhaseTransitionService transitions,
                         ProgressiveLearningService learning,
                         GenerationClient generation,
                         ValidationEngine validation,
                         VerdictProcessor verdicts,
                         JobLedger ledger,
                         StepOutputCodec outputCodec,
                         ObjectMapper json) {
        this.runRepo      = runRepo;
        this.jobRepo      = jobRepo;
        this.artifactRepo = artifactRepo;
        this.transitions  = transitions;
        this.learning     = learning;
        this.generation   = generation;
        this.validation   = validation;
        this.verdicts     = verdicts;
        this.ledger       = ledger;
        this.outputCodec  = outputCodec;
        this.json         = json;
    }

    /**
     * @return the status the job was released with, or empty if the lock was
     *         lost mid-attempt and the result discarded
     */
    public Optional<JobStatus> run(LockToken token) {
        MDC.put("runId",   token.runId().toString());
        MDC.put("jobId",   token.jobId().toString());
        MDC.put("step",    String.valueOf(token.step()));
        MDC.put("attempt", String.valueOf(token.attempt()));
        LockToken held = token;
        try {
            PipelineRun run = runRepo.findById(token.runId())
                    .orElseThrow(() -> new RunNotFoundException(token.runId()));
            PipelineJob job = jobRepo.findById(token.jobId())
                    .orElseThrow(() -> new JobNotFoundException(token.jobId()));

            enterWorkingPhase(run, token.step());
            PolicyContext policy = learning.assemblePolicyContext(run.getId(), run.getOwnerId(), token.step());
            QualityTier tier = QualityTier.effectiveFor(token.step(), run.getQualityTier());

            GenerationResult generated = generation.generate(requestFor(run, job, token, tier, policy));
            held = ledger.extendLock(held);

            Artifact artifact = artifactRepo.save(new Artifact(run.getId(), job.getId(), token.step(),
                    token.attempt(), kindOf(generated, token.step()), generated.storageRef(),
                    generated.width(), generated.height(), generated.sha256(), tier,
                    generated.analysis() == null || generated.analysis().isNull()
                            ? null : generated.analysis().toString()));

            ComparisonVerdict verdict = validation.validate(new ValidationRequest(
                    ArtifactUnderReview.of(artifact), expectationsFor(run, token.step(), tier), policy));

            RetryDecision decision = verdicts.process(held, run, artifact, verdict, policy);
            return Optional.of(statusOf(decision));

        } catch (GenerationException | JudgeException e) {
            return failCollaborator(held, e);
        } catch (LockLostException e) {
            log.warn("Lock on job {} lost mid-attempt, result discarded: {}", token.jobId(), e.getMessage());
            return Optional.empty();
        } catch (DataAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Attempt {} of job {} failed unexpectedly", token.attempt(), token.jobId(), e);
            releaseFailed(held, "Unexpected error: " + e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove("runId");
            MDC.remove("jobId");
            MDC.remove("step");
            MDC.remove("attempt");
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void enterWorkingPhase(PipelineRun run, int step) {
        if (run.getPhase().step() != step) return;
        Optional<Phase> working = PhaseStateMachine.workingPhaseOf(run.getPhase());
        if (working.isEmpty()) return;
        try {
            transitions.transition(run.getId(), run.getPhase(), working.get());
        } catch (TransitionException e) {
            // A sibling sub-unit of the same step got there first.
            if (e.getKind() != TransitionException.Kind.STALE_PHASE) throw e;
            log.debug("Run {} already left {}: {}", run.getId(), run.getPhase().wireName(), e.getMessage());
        }
    }

    private GenerationRequest requestFor(PipelineRun run, PipelineJob job, LockToken token,
                                         QualityTier tier, PolicyContext policy) {
        List<String> hard = policy.hardConstraints().stream().map(PolicyContext.ActiveRule::ruleText).toList();
        List<String> soft = policy.rules().stream()
                .filter(r -> !hard.contains(r.ruleText()))
                .map(PolicyContext.ActiveRule::ruleText)
                .toList();
        return new GenerationRequest(run.getId(), token.step(), token.serviceName(), token.attempt(),
                inputsFor(run, job), tier.label(), job.getCorrectiveInstructions(), hard, soft);
    }

    /** Explicit payload wins; otherwise the previous step's accepted output. */
    private List<String> inputsFor(PipelineRun run, PipelineJob job) {
        if (job.getPayloadRef() != null && !job.getPayloadRef().isBlank()) {
            try {
                return json.readValue(job.getPayloadRef(), ID_LIST);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Job " + job.getId() + " has an unreadable payload", e);
            }
        }
        if (job.getStep() == 0) return List.of();
        SortedMap<Integer, StepOutput> outputs = outputCodec.read(run.getStepOutputs());
        StepOutput previous = outputs.get(job.getStep() - 1);
        return previous == null ? List.of() : StepOutputs.artifactIdsOf(previous);
    }

    /** Detected-space count is checked against what space analysis found in step 0. */
    private ValidationExpectations expectationsFor(PipelineRun run, int step, QualityTier tier) {
        Integer expectedCount = null;
        if (step == 3) {
            StepOutput analysis = outputCodec.read(run.getStepOutputs()).get(0);
            if (analysis instanceof StepOutput.SpaceAnalysis sa && !sa.spaceIds().isEmpty()) {
                expectedCount = sa.spaceIds().size();
            }
        }
        return new ValidationExpectations(expectedCount, List.of(), tier,
                run.getUserRequest(), run.getStyleConstraints());
    }

    static ArtifactKind kindOf(GenerationResult generated, int step) {
        if (generated.kind() != null) {
            try {
                return ArtifactKind.valueOf(generated.kind().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.debug("Unknown artifact kind '{}', deriving from step {}", generated.kind(), step);
            }
        }
        return switch (step) {
            case 0, 3 -> generated.storageRef() == null ? ArtifactKind.ANALYSIS_JSON : ArtifactKind.IMAGE;
            case 7    -> ArtifactKind.PANORAMA;
            case 8    -> ArtifactKind.TOUR;
            default   -> ArtifactKind.IMAGE;
        };
    }

    private static JobStatus statusOf(RetryDecision decision) {
        return switch (decision.outcome()) {
            case PROCEED -> JobStatus.COMPLETED;
            case RETRY   -> JobStatus.PENDING;
            case BLOCKED -> JobStatus.BLOCKED;
        };
    }

    /** Collaborator failures are job failures, kept apart from validation failures. */
    private Optional<JobStatus> failCollaborator(LockToken held, RuntimeException e) {
        String message = "step %d %s attempt %d: %s".formatted(
                held.step(), held.serviceName(), held.attempt(), e.getMessage());
        log.error("Collaborator failure on job {}: {}", held.jobId(), message);
        boolean released = releaseFailed(held, message, e);
        transitions.recordError(held.runId(), message);
        return released ? Optional.of(JobStatus.FAILED) : Optional.empty();
    }

    private boolean releaseFailed(LockToken held, String message, Throwable cause) {
        try {
            ledger.releaseJob(held, JobRelease.failed(message, stackTraceOf(cause)));
            return true;
        } catch (LockLostException lost) {
            log.warn("Could not record failure on job {}, lock already lost: {}", held.jobId(), lost.getMessage());
            return false;
        }
    }

    private static String stackTraceOf(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
