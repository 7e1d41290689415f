package com.vistaplan.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.TestEntities;
import com.vistaplan.orchestrator.generation.GenerationClient;
import com.vistaplan.orchestrator.generation.GenerationException;
import com.vistaplan.orchestrator.generation.GenerationRequest;
import com.vistaplan.orchestrator.generation.GenerationResult;
import com.vistaplan.orchestrator.judge.JudgeException;
import com.vistaplan.orchestrator.learning.ProgressiveLearningService;
import com.vistaplan.orchestrator.ledger.JobLedger;
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
import com.vistaplan.orchestrator.model.StrengthStage;
import com.vistaplan.orchestrator.phase.PhaseTransitionService;
import com.vistaplan.orchestrator.phase.StepOutputCodec;
import com.vistaplan.orchestrator.phase.TransitionException;
import com.vistaplan.orchestrator.repository.ArtifactRepository;
import com.vistaplan.orchestrator.repository.PipelineJobRepository;
import com.vistaplan.orchestrator.repository.PipelineRunRepository;
import com.vistaplan.orchestrator.retry.RetryDecision;
import com.vistaplan.orchestrator.validation.ComparisonVerdict;
import com.vistaplan.orchestrator.validation.NextStep;
import com.vistaplan.orchestrator.validation.PolicyContext;
import com.vistaplan.orchestrator.validation.ValidationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AttemptRunnerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock PipelineRunRepository      runRepo;
    @Mock PipelineJobRepository      jobRepo;
    @Mock ArtifactRepository         artifactRepo;
    @Mock PhaseTransitionService     transitions;
    @Mock ProgressiveLearningService learning;
    @Mock GenerationClient           generation;
    @Mock ValidationEngine           validation;
    @Mock VerdictProcessor           verdicts;
    @Mock JobLedger                  ledger;

    final StepOutputCodec codec = new StepOutputCodec(new ObjectMapper());

    AttemptRunner runner;

    PipelineRun   run;
    PipelineJob   job;
    LockToken     token;
    PolicyContext policy;

    @BeforeEach
    void setUp() {
        runner = new AttemptRunner(runRepo, jobRepo, artifactRepo, transitions, learning, generation,
                validation, verdicts, ledger, codec, new ObjectMapper());

        run = TestEntities.withId(new PipelineRun("agent-7", QualityTier.Q4K));
        run.applyCommittedPhase(Phase.OUTPUTS_PENDING);
        job = TestEntities.withId(new PipelineJob(run.getId(), 6, "living_room", run.getId() + ":6:living_room", 3));
        job.incrementAttempts();
        job.setStatus(JobStatus.RUNNING);
        token = new LockToken(job.getId(), run.getId(), 6, "living_room", "worker-1", 1, NOW.plusSeconds(300), false);
        policy = new PolicyContext(List.of(
                new PolicyContext.ActiveRule(UUID.randomUUID(), "furniture_mismatch", "Avoid: sofa facing the wall", StrengthStage.GUARD),
                new PolicyContext.ActiveRule(UUID.randomUUID(), "style_inconsistency", "Avoid: chrome fixtures", StrengthStage.NUDGE)));

        lenient().when(runRepo.findById(run.getId())).thenReturn(Optional.of(run));
        lenient().when(jobRepo.findById(job.getId())).thenReturn(Optional.of(job));
        lenient().when(learning.assemblePolicyContext(run.getId(), "agent-7", 6)).thenReturn(policy);
        lenient().when(ledger.extendLock(any())).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(artifactRepo.save(any(Artifact.class)))
                .thenAnswer(inv -> TestEntities.withId(inv.<Artifact>getArgument(0)));
    }

    // -------------------------------------------------------------------------
    // Happy path
    // -------------------------------------------------------------------------

    @Test
    void run_firstAttemptPasses_entersWorkingPhaseAndCompletes() {
        ComparisonVerdict verdict = verdict(NextStep.PROCEED);
        when(generation.generate(any())).thenReturn(rendered());
        when(validation.validate(any())).thenReturn(verdict);
        when(verdicts.process(eq(token), eq(run), any(Artifact.class), eq(verdict), eq(policy)))
                .thenReturn(RetryDecision.proceed("passed on attempt 1"));

        Optional<JobStatus> status = runner.run(token);

        assertThat(status).contains(JobStatus.COMPLETED);
        verify(transitions).transition(run.getId(), Phase.OUTPUTS_PENDING, Phase.OUTPUTS_IN_PROGRESS);

        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generation).generate(request.capture());
        assertThat(request.getValue().qualityTier()).isEqualTo("4K");
        assertThat(request.getValue().hardConstraints()).containsExactly("Avoid: sofa facing the wall");
        assertThat(request.getValue().nudges()).containsExactly("Avoid: chrome fixtures");
        assertThat(request.getValue().correctiveInstructions()).isNull();

        ArgumentCaptor<Artifact> artifact = ArgumentCaptor.forClass(Artifact.class);
        verify(artifactRepo).save(artifact.capture());
        assertThat(artifact.getValue().getKind()).isEqualTo(ArtifactKind.IMAGE);
        assertThat(artifact.getValue().getQualityTier()).isEqualTo(QualityTier.Q4K);
        assertThat(artifact.getValue().getAttempt()).isEqualTo(1);
    }

    @Test
    void run_retryAttempt_carriesCorrectiveInstructionsAndStaysInPhase() {
        run.applyCommittedPhase(Phase.OUTPUTS_IN_PROGRESS);
        job.setCorrectiveInstructions("IMPORTANT: keep the sofa off the wall");
        ComparisonVerdict verdict = verdict(NextStep.RETRY);
        when(generation.generate(any())).thenReturn(rendered());
        when(validation.validate(any())).thenReturn(verdict);
        when(verdicts.process(any(), any(), any(), any(), any()))
                .thenReturn(RetryDecision.retry(NOW.plusSeconds(4), "next", "retry 3/3 in 4s"));

        Optional<JobStatus> status = runner.run(token);

        assertThat(status).contains(JobStatus.PENDING);
        verify(transitions, never()).transition(any(), any(), any());
        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generation).generate(request.capture());
        assertThat(request.getValue().correctiveInstructions()).isEqualTo("IMPORTANT: keep the sofa off the wall");
    }

    @Test
    void run_inputsComeFromPreviousStepOutput() {
        UUID templates = UUID.randomUUID();
        run.setStepOutputs(codec.withOutput(null, new StepOutput.PromptTemplates(templates)));
        when(generation.generate(any())).thenReturn(rendered());
        when(validation.validate(any())).thenReturn(verdict(NextStep.PROCEED));
        when(verdicts.process(any(), any(), any(), any(), any())).thenReturn(RetryDecision.proceed("ok"));

        runner.run(token);

        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(generation).generate(request.capture());
        assertThat(request.getValue().inputArtifactIds()).containsExactly(templates.toString());
    }

    @Test
    void run_siblingAlreadyEnteredWorkingPhase_continues() {
        when(transitions.transition(run.getId(), Phase.OUTPUTS_PENDING, Phase.OUTPUTS_IN_PROGRESS))
                .thenThrow(new TransitionException(TransitionException.Kind.STALE_PHASE, "moved"));
        when(generation.generate(any())).thenReturn(rendered());
        when(validation.validate(any())).thenReturn(verdict(NextStep.PROCEED));
        when(verdicts.process(any(), any(), any(), any(), any())).thenReturn(RetryDecision.proceed("ok"));

        assertThat(runner.run(token)).contains(JobStatus.COMPLETED);
    }

    // -------------------------------------------------------------------------
    // Failures
    // -------------------------------------------------------------------------

    @Test
    void run_generationFails_jobFailedAndErrorOnRun() {
        when(generation.generate(any())).thenThrow(new GenerationException("HTTP 503 from generation", true));

        Optional<JobStatus> status = runner.run(token);

        assertThat(status).contains(JobStatus.FAILED);
        ArgumentCaptor<JobRelease> release = ArgumentCaptor.forClass(JobRelease.class);
        verify(ledger).releaseJob(eq(token), release.capture());
        assertThat(release.getValue().status()).isEqualTo(JobStatus.FAILED);
        assertThat(release.getValue().error()).isEqualTo("step 6 living_room attempt 1: HTTP 503 from generation");
        assertThat(release.getValue().errorTrace()).contains("GenerationException");
        verify(transitions).recordError(eq(run.getId()), contains("HTTP 503"));
        verify(validation, never()).validate(any());
    }

    @Test
    void run_judgeTimesOut_jobFailed() {
        when(generation.generate(any())).thenReturn(rendered());
        when(validation.validate(any())).thenThrow(new JudgeException(JudgeException.Kind.TIMEOUT, "judge timed out"));

        assertThat(runner.run(token)).contains(JobStatus.FAILED);
        verify(verdicts, never()).process(any(), any(), any(), any(), any());
    }

    @Test
    void run_lockLostOnExtend_resultDiscarded() {
        when(generation.generate(any())).thenReturn(rendered());
        when(ledger.extendLock(token)).thenThrow(new LockLostException(job.getId(), "worker-1", "worker-2"));

        assertThat(runner.run(token)).isEmpty();
        verify(artifactRepo, never()).save(any());
        verify(ledger, never()).releaseJob(any(), any());
    }

    @Test
    void run_persistenceFailure_propagatesWithoutRelease() {
        when(generation.generate(any())).thenReturn(rendered());
        doThrow(new QueryTimeoutException("statement timeout")).when(artifactRepo).save(any(Artifact.class));

        assertThatThrownBy(() -> runner.run(token)).isInstanceOf(DataAccessException.class);
        verify(ledger, never()).releaseJob(any(), any());
    }

    @Test
    void run_unexpectedError_releasedAsFailedAndRethrown() {
        when(generation.generate(any())).thenReturn(rendered());
        when(validation.validate(any())).thenReturn(verdict(NextStep.PROCEED));
        when(verdicts.process(any(), any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> runner.run(token)).isInstanceOf(IllegalStateException.class);
        ArgumentCaptor<JobRelease> release = ArgumentCaptor.forClass(JobRelease.class);
        verify(ledger).releaseJob(eq(token), release.capture());
        assertThat(release.getValue().error()).isEqualTo("Unexpected error: boom");
    }

    // -------------------------------------------------------------------------
    // kindOf
    // -------------------------------------------------------------------------

    @Test
    void kindOf_declaredKindWins_unknownFallsBackToStep() {
        assertThat(AttemptRunner.kindOf(result("panorama", "s3://p"), 2)).isEqualTo(ArtifactKind.PANORAMA);
        assertThat(AttemptRunner.kindOf(result("hologram", "s3://t"), 8)).isEqualTo(ArtifactKind.TOUR);
        assertThat(AttemptRunner.kindOf(result(null, null), 0)).isEqualTo(ArtifactKind.ANALYSIS_JSON);
        assertThat(AttemptRunner.kindOf(result(null, "s3://i"), 3)).isEqualTo(ArtifactKind.IMAGE);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static GenerationResult rendered() {
        return new GenerationResult("IMAGE", "s3://renders/living.png", 3840, 2160, "f00d", "render-v2", null);
    }

    private static GenerationResult result(String kind, String ref) {
        return new GenerationResult(kind, ref, null, null, null, null, null);
    }

    private ComparisonVerdict verdict(NextStep next) {
        return new ComparisonVerdict(run.getId(), 6, next == NextStep.PROCEED, "Bright living room",
                List.of(), List.of(), next, 30L, "judge-model");
    }
}
