package com.vistaplan.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.learning.LearningInput;
import com.vistaplan.orchestrator.learning.LearningOutcome;
import com.vistaplan.orchestrator.learning.ProgressiveLearningService;
import com.vistaplan.orchestrator.ledger.JobLedger;
import com.vistaplan.orchestrator.ledger.JobNotFoundException;
import com.vistaplan.orchestrator.ledger.JobRelease;
import com.vistaplan.orchestrator.ledger.LockToken;
import com.vistaplan.orchestrator.model.Artifact;
import com.vistaplan.orchestrator.model.PipelineJob;
import com.vistaplan.orchestrator.model.PipelineRun;
import com.vistaplan.orchestrator.model.VerdictRecord;
import com.vistaplan.orchestrator.phase.PhaseTransitionService;
import com.vistaplan.orchestrator.repository.PipelineJobRepository;
import com.vistaplan.orchestrator.repository.VerdictRecordRepository;
import com.vistaplan.orchestrator.retry.AttemptSummary;
import com.vistaplan.orchestrator.retry.RetryDecision;
import com.vistaplan.orchestrator.retry.RetryOrchestrator;
import com.vistaplan.orchestrator.validation.ComparisonVerdict;
import com.vistaplan.orchestrator.validation.DeterministicRuleBattery;
import com.vistaplan.orchestrator.validation.PolicyContext;
import com.vistaplan.orchestrator.validation.Severity;
import com.vistaplan.orchestrator.validation.SpaceAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Second half of an attempt, shared by in-process attempts and verdicts
 * submitted by an external worker:
 *
 *   learning update → verdict record → retry decision → release → run bookkeeping
 *
 * The caller must hold the job's lock. It is checked (and renewed) before
 * anything is written, and the whole pass is one transaction, so a holder that
 * loses the lock halfway leaves no learning update or verdict record behind.
 */
@Component
public class VerdictProcessor {

    private static final Logger log = LoggerFactory.getLogger(VerdictProcessor.class);

    private final ProgressiveLearningService learning;
    private final VerdictRecordRepository    verdictRepo;
    private final PipelineJobRepository      jobRepo;
    private final RetryOrchestrator          retry;
    private final JobLedger                  ledger;
    private final PhaseTransitionService     transitions;
    private final ObjectMapper               json;

    public VerdictProcessor(ProgressiveLearningService learning,
                            VerdictRecordRepository verdictRepo,
                            PipelineJobRepository jobRepo,
                            RetryOrchestrator retry,
                            JobLedger ledger,
                            PhaseTransitionService transitions,
                            ObjectMapper json) {
        this.learning    = learning;
        this.verdictRepo = verdictRepo;
        this.jobRepo     = jobRepo;
        this.retry       = retry;
        this.ledger      = ledger;
        this.transitions = transitions;
        this.json        = json;
    }

    /** @throws com.vistaplan.orchestrator.ledger.LockLostException if the token no longer holds the job */
    @Transactional
    public RetryDecision process(LockToken presented, PipelineRun run, Artifact artifact,
                                 ComparisonVerdict verdict, PolicyContext policy) {
        LockToken token = ledger.extendLock(presented);
        SpaceAnalysis analysis = readAnalysis(artifact.getAnalysisJson());

        LearningOutcome learned = learning.recordVerdict(new LearningInput(
                run.getId(), run.getOwnerId(), token.step(), verdict, categoriesBySpaceId(analysis)));

        verdictRepo.save(new VerdictRecord(run.getId(), token.jobId(), artifact.getId(), token.step(),
                token.attempt(), verdict.pass(), verdict.recommendedNextStep().wireName(),
                (int) verdict.count(Severity.CRITICAL), (int) verdict.count(Severity.HIGH),
                verdict.failures().size(), toJson(verdict), toJson(learned.triggeredRuleIds())));

        PipelineJob job = jobRepo.findById(token.jobId())
                .orElseThrow(() -> new JobNotFoundException(token.jobId()));
        List<AttemptSummary> history = verdictRepo.findByJobIdOrderByAttemptAsc(token.jobId()).stream()
                .map(AttemptSummary::of)
                .toList();
        int runAttempts = (int) jobRepo.sumAttemptsForRun(run.getId());

        RetryDecision decision = retry.decide(job, verdict, runAttempts, policy, history);
        switch (decision.outcome()) {
            case PROCEED -> {
                ledger.releaseJob(token, JobRelease.completed(artifact.getId().toString()));
                transitions.recordStepOutput(run.getId(), StepOutputs.forArtifact(token.step(),
                        token.serviceName(), artifact.getId(), spaceIds(analysis)));
            }
            case RETRY -> ledger.releaseJob(token, JobRelease.retryAfter(
                    decision.notBefore(), decision.correctiveInstructions(), decision.reason()));
            case BLOCKED -> {
                String best = decision.bestArtifactId() == null ? null : decision.bestArtifactId().toString();
                ledger.releaseJob(token, JobRelease.blocked(best, decision.reason()));
                transitions.recordError(run.getId(), "Job %s (step %d, %s) blocked for review"
                        .formatted(token.jobId(), token.step(), token.serviceName()));
            }
        }
        log.info("Job {} attempt {} -> {} ({})", token.jobId(), token.attempt(), decision.outcome(),
                firstLine(decision.reason()));
        return decision;
    }

    /**
     * Lenient parse for bookkeeping. Schema problems were already reported by
     * the validation engine, so an unreadable document just yields null here.
     */
    SpaceAnalysis readAnalysis(String analysisJson) {
        if (analysisJson == null || analysisJson.isBlank()) return null;
        try {
            return json.readValue(analysisJson, SpaceAnalysis.class);
        } catch (JsonProcessingException e) {
            log.debug("Analysis document not readable for bookkeeping: {}", e.getOriginalMessage());
            return null;
        }
    }

    static Map<String, String> categoriesBySpaceId(SpaceAnalysis analysis) {
        Map<String, String> out = new HashMap<>();
        if (analysis == null) return out;
        for (SpaceAnalysis.DetectedSpace s : analysis.spaces()) {
            if (s.spaceId() != null && s.category() != null) out.put(s.spaceId(), s.category());
        }
        return out;
    }

    private static List<String> spaceIds(SpaceAnalysis analysis) {
        return analysis == null ? List.of() : DeterministicRuleBattery.spaceIds(analysis);
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private static String firstLine(String s) {
        if (s == null) return "";
        int nl = s.indexOf('\n');
        return nl < 0 ? s : s.substring(0, nl);
    }
}
