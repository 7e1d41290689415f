package com.vistaplan.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.learning.ProgressiveLearningService;
import com.vistaplan.orchestrator.learning.RuleOverride;
import com.vistaplan.orchestrator.ledger.AcquireResult;
import com.vistaplan.orchestrator.ledger.IllegalJobStateException;
import com.vistaplan.orchestrator.ledger.JobLedger;
import com.vistaplan.orchestrator.ledger.JobNotFoundException;
import com.vistaplan.orchestrator.ledger.JobRequestResult;
import com.vistaplan.orchestrator.ledger.LockToken;
import com.vistaplan.orchestrator.model.Artifact;
import com.vistaplan.orchestrator.model.ArtifactKind;
import com.vistaplan.orchestrator.model.JobStatus;
import com.vistaplan.orchestrator.model.Phase;
import com.vistaplan.orchestrator.model.PipelineJob;
import com.vistaplan.orchestrator.model.PipelineRun;
import com.vistaplan.orchestrator.model.PolicyRule;
import com.vistaplan.orchestrator.model.PromotionLogEntry;
import com.vistaplan.orchestrator.model.PromotionType;
import com.vistaplan.orchestrator.model.QualityTier;
import com.vistaplan.orchestrator.model.VerdictRecord;
import com.vistaplan.orchestrator.phase.PhaseStateMachine;
import com.vistaplan.orchestrator.phase.PhaseTransitionService;
import com.vistaplan.orchestrator.repository.ArtifactRepository;
import com.vistaplan.orchestrator.repository.PipelineJobRepository;
import com.vistaplan.orchestrator.repository.PipelineRunRepository;
import com.vistaplan.orchestrator.repository.PolicyRuleRepository;
import com.vistaplan.orchestrator.repository.PromotionLogRepository;
import com.vistaplan.orchestrator.repository.VerdictRecordRepository;
import com.vistaplan.orchestrator.retry.RetryDecision;
import com.vistaplan.orchestrator.validation.ComparisonVerdict;
import com.vistaplan.orchestrator.validation.DeterministicRuleBattery;
import com.vistaplan.orchestrator.validation.PolicyContext;
import com.vistaplan.orchestrator.validation.SpaceAnalysis;
import com.vistaplan.orchestrator.validation.ValidationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * The operations exposed to callers: runs, transitions, jobs, verdicts,
 * overrides and human decisions. Each one checks its preconditions and
 * delegates; none of them talks to a collaborator.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private static final TypeReference<List<UUID>> UUID_LIST = new TypeReference<>() {};

    private final PipelineRunRepository      runRepo;
    private final PipelineJobRepository      jobRepo;
    private final ArtifactRepository         artifactRepo;
    private final VerdictRecordRepository    verdictRepo;
    private final PolicyRuleRepository       ruleRepo;
    private final PromotionLogRepository     promotionLog;
    private final PhaseTransitionService     transitions;
    private final JobLedger                  ledger;
    private final ProgressiveLearningService learning;
    private final ValidationEngine           validation;
    private final VerdictProcessor           verdicts;
    private final ObjectMapper               json;
    private final Clock                      clock;

    public PipelineService(PipelineRunRepository runRepo,
                           PipelineJobRepository jobRepo,
                           ArtifactRepository artifactRepo,
                           VerdictRecordRepository verdictRepo,
                           PolicyRuleRepository ruleRepo,
                           PromotionLogRepository promotionLog,
                           PhaseTransitionService transitions,
                           JobLedger ledger,
                           ProgressiveLearningService learning,
                           ValidationEngine validation,
                           VerdictProcessor verdicts,
                           ObjectMapper json,
                           Clock clock) {
        this.runRepo      = runRepo;
        this.jobRepo      = jobRepo;
        this.artifactRepo = artifactRepo;
        this.verdictRepo  = verdictRepo;
        this.ruleRepo     = ruleRepo;
        this.promotionLog = promotionLog;
        this.transitions  = transitions;
        this.ledger       = ledger;
        this.learning     = learning;
        this.validation   = validation;
        this.verdicts     = verdicts;
        this.json         = json;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Runs
    // ------------------------------------------------------------------

    @Transactional
    public PipelineRun startRun(StartRunCommand cmd) {
        if (cmd.ownerId() == null || cmd.ownerId().isBlank()) {
            throw new IllegalArgumentException("ownerId is required");
        }
        QualityTier tier = cmd.qualityTier() == null ? QualityTier.Q2K : cmd.qualityTier();
        PipelineRun run = new PipelineRun(cmd.ownerId(), tier);
        run.setUserRequest(cmd.userRequest());
        run.setStyleConstraints(cmd.styleConstraints());
        run = runRepo.save(run);
        log.info("Run {} started for owner {} (tier {})", run.getId(), cmd.ownerId(), tier.label());
        return run;
    }

    public PipelineRun getRun(UUID runId) {
        return runRepo.findById(runId).orElseThrow(() -> new RunNotFoundException(runId));
    }

    public List<PipelineRun> runsForOwner(String ownerId) {
        return runRepo.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    /**
     * @param expected wire name of the phase the caller believes the run is in
     * @param target   optional wire name of the phase the caller wants
     */
    public PipelineRun requestTransition(UUID runId, String expected, String target) {
        Phase from = PhaseStateMachine.parse(expected);
        Phase to   = target == null || target.isBlank() ? null : PhaseStateMachine.parse(target);
        return transitions.transition(runId, from, to);
    }

    public void pause(UUID runId)  { transitions.pause(runId); }
    public void resume(UUID runId) { transitions.resume(runId); }

    // ------------------------------------------------------------------
    // Jobs
    // ------------------------------------------------------------------

    /** Queue work for the dispatcher. Idempotent on the key and on the open unit. */
    public JobRequestResult requestJob(UUID runId, int step, String service,
                                       String idempotencyKey, List<String> inputArtifactIds) {
        checkDispatchable(getRun(runId), step);
        String payload = inputArtifactIds == null || inputArtifactIds.isEmpty() ? null : toJson(inputArtifactIds);
        return ledger.requestJob(runId, step, service, idempotencyKey, payload);
    }

    /** Lock a unit for an external worker, which reports back through {@link #submitVerdict}. */
    public AcquireResult acquireJob(UUID runId, int step, String service, String idempotencyKey, String holder) {
        checkDispatchable(getRun(runId), step);
        return ledger.acquireJob(runId, step, service, idempotencyKey, holder);
    }

    public PipelineJob getJob(UUID jobId) {
        return jobRepo.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<PipelineJob> jobsForRun(UUID runId) {
        getRun(runId);
        return jobRepo.findByRunIdOrderByCreatedAtAsc(runId);
    }

    /**
     * Finish an externally executed attempt. The submitted verdict's pass and
     * next step are recomputed; everything after that is the same path an
     * in-process attempt takes.
     *
     * @throws com.vistaplan.orchestrator.ledger.LockLostException if {@code holder} no longer holds the job
     */
    @Transactional
    public RetryDecision submitVerdict(UUID jobId, SubmittedAttempt attempt) {
        PipelineJob job = getJob(jobId);
        if (job.getStatus() != JobStatus.RUNNING) {
            throw new IllegalJobStateException(jobId, job.getStatus(), "verdicts are only accepted for RUNNING jobs");
        }
        ComparisonVerdict submitted = attempt.verdict();
        if (submitted == null || !job.getRunId().equals(submitted.runId()) || submitted.stepId() != job.getStep()) {
            throw new IllegalArgumentException("verdict does not belong to job " + jobId);
        }
        PipelineRun run = getRun(job.getRunId());
        LockToken token = ledger.extendLock(new LockToken(job.getId(), job.getRunId(), job.getStep(),
                job.getServiceName(), attempt.holder(), job.getAttempts(), job.getLockExpiresAt(), false));

        Artifact artifact = artifactRepo.save(new Artifact(run.getId(), job.getId(), job.getStep(),
                job.getAttempts(), ArtifactKind.IMAGE, attempt.storageRef(), attempt.width(), attempt.height(),
                attempt.sha256(), QualityTier.effectiveFor(job.getStep(), run.getQualityTier()),
                attempt.analysisJson()));
        ComparisonVerdict verdict = validation.normalize(submitted, artifact.getId());
        PolicyContext policy = learning.assemblePolicyContext(run.getId(), run.getOwnerId(), job.getStep());
        return verdicts.process(token, run, artifact, verdict, policy);
    }

    public List<VerdictRecord> verdictsForJob(UUID jobId) {
        getJob(jobId);
        return verdictRepo.findByJobIdOrderByAttemptAsc(jobId);
    }

    public List<VerdictRecord> verdictsForRun(UUID runId) {
        getRun(runId);
        return verdictRepo.findByRunIdOrderByCreatedAtAsc(runId);
    }

    // ------------------------------------------------------------------
    // Human decisions
    // ------------------------------------------------------------------

    /**
     * Terminal decision on a BLOCKED job, written to the promotion log next to
     * rule escalations.
     *
     * APPROVE accepts the job's best attempt as the step output and charges a
     * false positive to every rule that fired on it. REJECT_AND_STOP fails the
     * job and leaves the reason on the run.
     */
    @Transactional
    public PipelineJob recordDecision(UUID jobId, HumanDecision decision, String actor, String reason) {
        JobStatus outcome = decision == HumanDecision.APPROVE ? JobStatus.COMPLETED : JobStatus.FAILED;
        String note = decision == HumanDecision.REJECT_AND_STOP
                ? "Stopped by " + actor + (reason == null ? "" : ": " + reason)
                : null;
        PipelineJob job = ledger.resolveBlocked(jobId, outcome, note);
        PipelineRun run = getRun(job.getRunId());

        if (decision == HumanDecision.APPROVE) {
            UUID approvedArtifact = job.getResultRef() == null ? null : UUID.fromString(job.getResultRef());
            learning.recordFalsePositive(rulesTriggeredOn(jobId, approvedArtifact), actor,
                    reason == null ? "approved by " + actor : reason);
            if (approvedArtifact != null) {
                artifactRepo.findById(approvedArtifact).ifPresent(a -> transitions.recordStepOutput(run.getId(),
                        StepOutputs.forArtifact(job.getStep(), job.getServiceName(), a.getId(), spaceIdsOf(a))));
            }
        } else {
            transitions.recordError(run.getId(), note);
        }

        PromotionType type = decision == HumanDecision.APPROVE
                ? PromotionType.HUMAN_APPROVED : PromotionType.HUMAN_REJECTED;
        promotionLog.save(PromotionLogEntry.forJobDecision(job, run.getOwnerId(), type, JobStatus.BLOCKED,
                actor, reason == null ? decision.name() : reason, clock.instant()));
        log.info("Job {} {} by {}", jobId, decision, actor);
        return job;
    }

    // ------------------------------------------------------------------
    // Rules
    // ------------------------------------------------------------------

    public PolicyRule recordOverride(UUID ruleId, RuleOverride override, String actor, String reason) {
        return learning.applyOverride(ruleId, override, actor, reason);
    }

    public int resetProfile(String ownerId, String actor) {
        return learning.resetProfile(ownerId, actor);
    }

    public List<PolicyRule> rulesForOwner(String ownerId) {
        return ruleRepo.findByOwnerIdOrderByCreatedAtAsc(ownerId);
    }

    public List<PromotionLogEntry> promotionLogForRun(UUID runId) {
        getRun(runId);
        return promotionLog.findByRunIdOrderByCreatedAtAsc(runId);
    }

    public List<PromotionLogEntry> promotionLogForRule(UUID ruleId) {
        return promotionLog.findByRuleIdOrderByCreatedAtAsc(ruleId);
    }

    public List<PromotionLogEntry> promotionLogForOwner(String ownerId) {
        return promotionLog.findByOwnerIdOrderByCreatedAtDesc(ownerId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static void checkDispatchable(PipelineRun run, int step) {
        if (run.getPhase() == Phase.COMPLETED) {
            throw new DispatchRefusedException(DispatchRefusedException.Reason.RUN_COMPLETED,
                    run.getId(), "run is completed");
        }
        if (run.isPaused()) {
            throw new DispatchRefusedException(DispatchRefusedException.Reason.RUN_PAUSED,
                    run.getId(), "run is paused");
        }
        if (run.getCurrentStep() != step) {
            throw new DispatchRefusedException(DispatchRefusedException.Reason.WRONG_STEP, run.getId(),
                    "run is at step " + run.getCurrentStep() + ", not " + step);
        }
    }

    /** Rules that fired on the approved attempt, or on the latest one if none matches. */
    private List<UUID> rulesTriggeredOn(UUID jobId, UUID approvedArtifact) {
        List<VerdictRecord> records = verdictRepo.findByJobIdOrderByAttemptAsc(jobId);
        if (records.isEmpty()) return List.of();
        VerdictRecord chosen = records.stream()
                .filter(r -> approvedArtifact != null && approvedArtifact.equals(r.getArtifactId()))
                .findFirst()
                .orElse(records.get(records.size() - 1));
        if (chosen.getTriggeredRuleIds() == null) return List.of();
        try {
            return json.readValue(chosen.getTriggeredRuleIds(), UUID_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt triggered-rule list on verdict " + chosen.getId(), e);
        }
    }

    private List<String> spaceIdsOf(Artifact artifact) {
        SpaceAnalysis analysis = verdicts.readAnalysis(artifact.getAnalysisJson());
        return analysis == null ? List.of() : DeterministicRuleBattery.spaceIds(analysis);
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize " + value, e);
        }
    }
}
