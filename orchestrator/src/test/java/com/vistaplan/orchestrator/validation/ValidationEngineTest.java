package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.judge.JudgeException;
import com.vistaplan.orchestrator.model.QualityTier;
import com.vistaplan.orchestrator.model.StrengthStage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * The three validation stages wired together, with the semantic judge mocked.
 */
@ExtendWith(MockitoExtension.class)
class ValidationEngineTest {

    @Mock SemanticJudge judge;

    SimpleMeterRegistry meters;
    ValidationEngine engine;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        engine = new ValidationEngine(judge, new ObjectMapper(), meters);
    }

    @Test
    void cleanAnalysis_withoutUserText_proceedsRulesOnly() {
        ComparisonVerdict v = engine.validate(request(Analyses.validJson(),
                new ValidationExpectations(3, List.of("kitchen"), QualityTier.Q2K, null, null)));

        assertThat(v.pass()).isTrue();
        assertThat(v.recommendedNextStep()).isEqualTo(NextStep.PROCEED);
        assertThat(v.modelUsed()).isEqualTo(ValidationEngine.RULES_ONLY);
        assertThat(v.userRequestSummary()).startsWith("No user request supplied");
        verifyNoInteractions(judge);
        assertThat(meters.counter("vistaplan.verdicts", "next_step", "proceed").count()).isEqualTo(1.0);
    }

    @Test
    void schemaViolation_isCriticalAndSkipsLaterStages() {
        String broken = Analyses.validJson().replace("\"model_used\": \"vision-x\",", "");

        ComparisonVerdict v = engine.validate(request(broken,
                new ValidationExpectations(9, null, null, "Cosy loft", null)));

        assertThat(v.failures()).singleElement().satisfies(f -> {
            assertThat(f.type()).isEqualTo(FailureType.SCHEMA_INVALID);
            assertThat(f.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(f.description()).contains("model_used");
        });
        assertThat(v.recommendedNextStep()).isEqualTo(NextStep.BLOCK_FOR_HUMAN);
        verifyNoInteractions(judge);
    }

    @Test
    void eachSchemaViolation_isItsOwnCriticalFailure() {
        String broken = Analyses.validJson()
                .replace("\"model_used\": \"vision-x\",", "")
                .replace("\"processing_time_ms\": 850", "\"processing_time_ms\": -3");

        ComparisonVerdict v = engine.validate(request(broken, ValidationExpectations.none()));

        assertThat(v.failures()).hasSize(2).allSatisfy(f -> {
            assertThat(f.type()).isEqualTo(FailureType.SCHEMA_INVALID);
            assertThat(f.severity()).isEqualTo(Severity.CRITICAL);
        });
        assertThat(v.failures()).extracting(ComparisonFailure::description)
                .anySatisfy(d -> assertThat(d).contains("model_used"))
                .anySatisfy(d -> assertThat(d).contains("processing_time_ms"));
    }

    @Test
    void notJson_isSchemaInvalid() {
        ComparisonVerdict v = engine.validate(request("{spaces: [", ValidationExpectations.none()));

        assertThat(v.failures()).singleElement().extracting(ComparisonFailure::description)
                .asString().contains("not valid JSON");
    }

    @Test
    void noAnalysisAndNoDimensions_isSchemaInvalid() {
        ArtifactUnderReview artifact = new ArtifactUnderReview(Analyses.RUN, 6, UUID.randomUUID(), null, null, null);

        ComparisonVerdict v = engine.validate(new ValidationRequest(artifact, null, null));

        assertThat(v.recommendedNextStep()).isEqualTo(NextStep.BLOCK_FOR_HUMAN);
        assertThat(v.hasFailureOfType(FailureType.SCHEMA_INVALID)).isTrue();
    }

    @Test
    void imageOnlyArtifact_runsResolutionCheck() {
        ArtifactUnderReview artifact = new ArtifactUnderReview(Analyses.RUN, 6, UUID.randomUUID(), 1920, 1080, null);

        ComparisonVerdict v = engine.validate(new ValidationRequest(artifact,
                new ValidationExpectations(null, null, QualityTier.Q2K, null, null), null));

        assertThat(v.pass()).isTrue();
        assertThat(v.failures()).isEmpty();
    }

    @Test
    void imageOnlyArtifact_withUserText_skipsJudge() {
        ArtifactUnderReview artifact = new ArtifactUnderReview(Analyses.RUN, 6, UUID.randomUUID(), 1920, 1080, null);

        ComparisonVerdict v = engine.validate(new ValidationRequest(artifact,
                new ValidationExpectations(null, null, QualityTier.Q2K, "Bright Scandinavian living room", null), null));

        assertThat(v.modelUsed()).isEqualTo(ValidationEngine.RULES_ONLY);
        assertThat(v.userRequestSummary()).isEqualTo("Bright Scandinavian living room");
        verifyNoInteractions(judge);
    }

    @Test
    void countFarOff_retries() {
        ComparisonVerdict v = engine.validate(request(Analyses.validJson(),
                new ValidationExpectations(7, null, null, null, null)));

        assertThat(v.recommendedNextStep()).isEqualTo(NextStep.RETRY);
        assertThat(v.failures()).extracting(ComparisonFailure::type).containsExactly(FailureType.MISSING_SPACE);
        assertThat(v.suggestedFixes()).isSortedAccordingTo((a, b) -> Integer.compare(a.priority(), b.priority()));
    }

    @Test
    void userText_runsJudgeAndMergesNewFindingsOnly() {
        when(judge.judge(any())).thenReturn(new SemanticJudge.Findings(
                List.of(ComparisonFailure.of(FailureType.MISSING_SPACE, Severity.HIGH,
                                "Detected 3 spaces but 7 were expected, per the user"),
                        ComparisonFailure.of(FailureType.STYLE_INCONSISTENCY, Severity.MEDIUM,
                                "Kitchen cabinets are glossy white, user asked for matte oak")),
                List.of(new SuggestedFix(FixTarget.PROMPT, "Use matte oak cabinet fronts", "Matches request", 3)),
                "Scandinavian flat with oak kitchen",
                "claude-sonnet-4-6"));
        PolicyContext policy = new PolicyContext(List.of(new PolicyContext.ActiveRule(
                UUID.randomUUID(), "style_inconsistency", "Avoid: glossy finishes", StrengthStage.CHECK)));

        ComparisonVerdict v = engine.validate(new ValidationRequest(
                new ArtifactUnderReview(Analyses.RUN, 2, UUID.randomUUID(), null, null, Analyses.validJson()),
                new ValidationExpectations(7, null, null, "Scandinavian, oak kitchen", null),
                policy));

        assertThat(v.failures()).extracting(ComparisonFailure::type)
                .containsExactly(FailureType.MISSING_SPACE, FailureType.STYLE_INCONSISTENCY);
        assertThat(v.userRequestSummary()).isEqualTo("Scandinavian flat with oak kitchen");
        assertThat(v.modelUsed()).isEqualTo("claude-sonnet-4-6");

        ArgumentCaptor<SemanticJudge.Request> sent = ArgumentCaptor.forClass(SemanticJudge.Request.class);
        verify(judge).judge(sent.capture());
        assertThat(sent.getValue().spaces()).hasSize(3);
        assertThat(sent.getValue().policyRules()).hasSize(1);
    }

    @Test
    void judgeFailure_propagates() {
        when(judge.judge(any())).thenThrow(new JudgeException(JudgeException.Kind.API_ERROR, "judge unavailable after 3 attempts"));

        assertThatThrownBy(() -> engine.validate(request(Analyses.validJson(),
                new ValidationExpectations(null, null, null, null, "Industrial loft"))))
                .isInstanceOf(JudgeException.class);
    }

    @Test
    void normalize_recomputesDecisionFromFailures() {
        ComparisonVerdict submitted = new ComparisonVerdict(Analyses.RUN, 6, true, "Bright bedroom",
                List.of(ComparisonFailure.of(FailureType.GEOMETRY_ERROR, Severity.HIGH, "Window on wrong wall")),
                List.of(new SuggestedFix(FixTarget.PROMPT, "b", "e", 5), new SuggestedFix(FixTarget.PROMPT, "a", "e", 2)),
                NextStep.PROCEED, 300, null);

        ComparisonVerdict v = engine.normalize(submitted, UUID.randomUUID());

        assertThat(v.pass()).isFalse();
        assertThat(v.recommendedNextStep()).isEqualTo(NextStep.RETRY);
        assertThat(v.modelUsed()).isEqualTo("external");
        assertThat(v.suggestedFixes()).extracting(SuggestedFix::action).containsExactly("a", "b");
    }

    private static ValidationRequest request(String analysisJson, ValidationExpectations expectations) {
        return new ValidationRequest(
                new ArtifactUnderReview(Analyses.RUN, 0, UUID.randomUUID(), null, null, analysisJson),
                expectations, PolicyContext.empty());
    }
}
