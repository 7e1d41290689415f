package com.vistaplan.orchestrator.learning;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.TestEntities;
import com.vistaplan.orchestrator.model.PolicyRule;
import com.vistaplan.orchestrator.model.PromotionLogEntry;
import com.vistaplan.orchestrator.model.PromotionType;
import com.vistaplan.orchestrator.model.RuleOccurrence;
import com.vistaplan.orchestrator.model.RuleScope;
import com.vistaplan.orchestrator.model.StrengthStage;
import com.vistaplan.orchestrator.repository.PolicyRuleRepository;
import com.vistaplan.orchestrator.repository.PromotionLogRepository;
import com.vistaplan.orchestrator.repository.RuleOccurrenceRepository;
import com.vistaplan.orchestrator.validation.ComparisonFailure;
import com.vistaplan.orchestrator.validation.ComparisonVerdict;
import com.vistaplan.orchestrator.validation.FailureType;
import com.vistaplan.orchestrator.validation.NextStep;
import com.vistaplan.orchestrator.validation.PolicyContext;
import com.vistaplan.orchestrator.validation.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressiveLearningServiceTest {

    private static final Instant NOW   = Instant.parse("2026-03-01T10:00:00Z");
    private static final UUID    RUN   = UUID.randomUUID();
    private static final String  OWNER = "agent-7";
    private static final int     STEP  = 3;

    private static final ComparisonFailure NO_BED = ComparisonFailure.of(
            FailureType.FURNITURE_MISMATCH, Severity.HIGH, "Bedroom 2 has no bed").forSpace("s1");
    private static final String NO_BED_KEY = RuleKeys.keyFor(STEP, NO_BED);

    @Mock PolicyRuleRepository     ruleRepo;
    @Mock RuleOccurrenceRepository occurrenceRepo;
    @Mock PromotionLogRepository   promotionLog;

    ProgressiveLearningService service;

    @BeforeEach
    void setUp() {
        service = new ProgressiveLearningService(ruleRepo, occurrenceRepo, promotionLog,
                new ObjectMapper(), new SimpleMeterRegistry(), Clock.fixed(NOW, ZoneOffset.UTC));
        lenient().when(ruleRepo.save(any(PolicyRule.class))).thenAnswer(inv -> {
            PolicyRule r = inv.getArgument(0);
            return r.getId() == null ? TestEntities.withId(r) : r;
        });
    }

    // -------------------------------------------------------------------------
    // Violations
    // -------------------------------------------------------------------------

    @Test
    void recordVerdict_firstRejection_createsRunRuleAtNudge() {
        LearningOutcome outcome = service.recordVerdict(input(verdict(false, NO_BED)));

        ArgumentCaptor<PolicyRule> saved = ArgumentCaptor.forClass(PolicyRule.class);
        verify(ruleRepo).save(saved.capture());
        PolicyRule rule = saved.getValue();
        assertThat(rule.getScope()).isEqualTo(RuleScope.RUN);
        assertThat(rule.getRunId()).isEqualTo(RUN);
        assertThat(rule.getRuleKey()).isEqualTo(NO_BED_KEY);
        assertThat(rule.getViolationCount()).isEqualTo(1);
        assertThat(rule.getStrengthStage()).isEqualTo(StrengthStage.NUDGE);
        assertThat(rule.getContextConditions()).contains("bedroom");
        assertThat(outcome.createdRuleIds()).containsExactly(rule.getId());

        verify(occurrenceRepo).save(any(RuleOccurrence.class));
        assertThat(loggedTypes()).containsExactly(PromotionType.CREATED);
    }

    @Test
    void recordVerdict_thirdViolationInRun_escalatesToCheck() {
        PolicyRule runRule = rule(RuleScope.RUN, NO_BED_KEY, NOW);
        runRule.setViolationCount(2);
        when(ruleRepo.findByScopeAndRunIdAndRuleKey(RuleScope.RUN, RUN, NO_BED_KEY))
                .thenReturn(Optional.of(runRule));

        LearningOutcome outcome = service.recordVerdict(input(verdict(false, NO_BED)));

        assertThat(outcome.createdRuleIds()).isEmpty();
        assertThat(runRule.getViolationCount()).isEqualTo(3);
        assertThat(runRule.getStrengthStage()).isEqualTo(StrengthStage.CHECK);
        PromotionLogEntry entry = loggedEntries().get(0);
        assertThat(entry.getPromotionType()).isEqualTo(PromotionType.ESCALATED);
        assertThat(entry.getFromValue()).isEqualTo("NUDGE");
        assertThat(entry.getToValue()).isEqualTo("CHECK");
    }

    @Test
    void recordVerdict_keySeenInThirdRun_promotesToActorScope() {
        when(occurrenceRepo.countDistinctRuns(NO_BED_KEY, OWNER)).thenReturn(3L);

        LearningOutcome outcome = service.recordVerdict(input(verdict(false, NO_BED)));

        assertThat(outcome.createdRuleIds()).hasSize(2);
        ArgumentCaptor<PolicyRule> saved = ArgumentCaptor.forClass(PolicyRule.class);
        verify(ruleRepo, atLeastOnce()).save(saved.capture());
        PolicyRule actorRule = saved.getAllValues().stream()
                .filter(r -> r.getScope() == RuleScope.ACTOR)
                .findFirst().orElseThrow();
        assertThat(actorRule.getOwnerId()).isEqualTo(OWNER);
        assertThat(actorRule.getRunId()).isNull();
        assertThat(actorRule.getViolationCount()).isEqualTo(3);
        assertThat(actorRule.getStrengthStage()).isEqualTo(StrengthStage.CHECK);
        assertThat(loggedTypes()).containsExactly(PromotionType.CREATED, PromotionType.SCOPE_PROMOTED);
    }

    @Test
    void recordVerdict_actorRuleHeldByThreeOwners_promotesToGlobalScope() {
        PolicyRule runRule   = rule(RuleScope.RUN, NO_BED_KEY, NOW);
        PolicyRule actorRule = rule(RuleScope.ACTOR, NO_BED_KEY, NOW);
        actorRule.setViolationCount(4);
        when(ruleRepo.findByScopeAndRunIdAndRuleKey(RuleScope.RUN, RUN, NO_BED_KEY))
                .thenReturn(Optional.of(runRule));
        when(ruleRepo.findByScopeAndOwnerIdAndRuleKey(RuleScope.ACTOR, OWNER, NO_BED_KEY))
                .thenReturn(Optional.of(actorRule));
        when(ruleRepo.findByScopeAndRuleKeyAndDisabledFalse(RuleScope.ACTOR, NO_BED_KEY))
                .thenReturn(List.of(actorRule, ownedBy("agent-8"), ownedBy("agent-9")));
        when(occurrenceRepo.countDistinctRunsAllOwners(NO_BED_KEY)).thenReturn(6L);

        LearningOutcome outcome = service.recordVerdict(input(verdict(false, NO_BED)));

        assertThat(outcome.createdRuleIds()).hasSize(1);
        assertThat(actorRule.getViolationCount()).isEqualTo(5);
        ArgumentCaptor<PolicyRule> saved = ArgumentCaptor.forClass(PolicyRule.class);
        verify(ruleRepo).save(saved.capture());
        PolicyRule global = saved.getValue();
        assertThat(global.getScope()).isEqualTo(RuleScope.GLOBAL);
        assertThat(global.getOwnerId()).isNull();
        assertThat(global.getStrengthStage()).isEqualTo(StrengthStage.GUARD);
        assertThat(loggedTypes()).contains(PromotionType.SCOPE_PROMOTED);
    }

    @Test
    void recordVerdict_twoOwnersOnly_noGlobalRule() {
        PolicyRule runRule   = rule(RuleScope.RUN, NO_BED_KEY, NOW);
        PolicyRule actorRule = rule(RuleScope.ACTOR, NO_BED_KEY, NOW);
        when(ruleRepo.findByScopeAndRunIdAndRuleKey(RuleScope.RUN, RUN, NO_BED_KEY))
                .thenReturn(Optional.of(runRule));
        when(ruleRepo.findByScopeAndOwnerIdAndRuleKey(RuleScope.ACTOR, OWNER, NO_BED_KEY))
                .thenReturn(Optional.of(actorRule));
        when(ruleRepo.findByScopeAndRuleKeyAndDisabledFalse(RuleScope.ACTOR, NO_BED_KEY))
                .thenReturn(List.of(actorRule, ownedBy("agent-8")));

        LearningOutcome outcome = service.recordVerdict(input(verdict(false, NO_BED)));

        assertThat(outcome.createdRuleIds()).isEmpty();
        verify(occurrenceRepo, never()).countDistinctRunsAllOwners(any());
    }

    @Test
    void recordVerdict_collaboratorOutage_notLearned() {
        ComparisonFailure timeout = ComparisonFailure.of(FailureType.TIMEOUT, Severity.HIGH, "judge timed out");

        LearningOutcome outcome = service.recordVerdict(input(verdict(false, timeout)));

        assertThat(outcome.createdRuleIds()).isEmpty();
        verify(ruleRepo, never()).save(any());
        verify(occurrenceRepo, never()).save(any());
    }

    // -------------------------------------------------------------------------
    // Triggers and confidence
    // -------------------------------------------------------------------------

    @Test
    void recordVerdict_existingRuleMatchesRejection_triggeredAndCounted() {
        PolicyRule existing = rule(RuleScope.RUN, NO_BED_KEY, NOW);
        existing.setViolationCount(1);
        when(ruleRepo.findApplicable(RUN, OWNER, STEP)).thenReturn(List.of(existing));
        when(ruleRepo.findByScopeAndRunIdAndRuleKey(RuleScope.RUN, RUN, NO_BED_KEY))
                .thenReturn(Optional.of(existing));

        LearningOutcome outcome = service.recordVerdict(input(verdict(false, NO_BED)));

        assertThat(outcome.triggeredRuleIds()).containsExactly(existing.getId());
        assertThat(existing.getTriggeredCount()).isEqualTo(1);
        assertThat(existing.getRejectedDueToTrigger()).isEqualTo(1);
        assertThat(existing.getLastTriggeredAt()).isEqualTo(NOW);
        assertThat(existing.getConfidenceScore()).isEqualTo(1.0);
        assertThat(existing.getViolationCount()).isEqualTo(2);
    }

    @Test
    void recordVerdict_fifthTriggerWithPoorRecord_capsAtNudge() {
        PolicyRule existing = rule(RuleScope.ACTOR, NO_BED_KEY, NOW);
        existing.setStrengthStage(StrengthStage.GUARD);
        existing.setTriggeredCount(4);
        existing.setRejectedDueToTrigger(1);
        existing.setApprovedDespiteTrigger(3);
        when(ruleRepo.findApplicable(RUN, OWNER, STEP)).thenReturn(List.of(existing));

        ComparisonFailure minor = new ComparisonFailure(FailureType.FURNITURE_MISMATCH,
                "Bedroom 2 has no bed", Severity.LOW, "s1", null, null);
        service.recordVerdict(input(verdict(true, minor)));

        assertThat(existing.getTriggeredCount()).isEqualTo(5);
        assertThat(existing.isConfidenceCapped()).isTrue();
        assertThat(existing.getConfidenceScore()).isEqualTo(0.2);
        assertThat(existing.getStrengthStage()).isEqualTo(StrengthStage.NUDGE);
        PromotionLogEntry entry = loggedEntries().get(0);
        assertThat(entry.getPromotionType()).isEqualTo(PromotionType.CONFIDENCE_CAPPED);
        assertThat(entry.getFromValue()).isEqualTo("GUARD");
    }

    @Test
    void recordVerdict_passWithoutTrigger_goodBehaviourDecay() {
        PolicyRule other = rule(RuleScope.ACTOR, "3:missing_space:kitchen missing", NOW);
        when(ruleRepo.findApplicable(RUN, OWNER, STEP)).thenReturn(List.of(other));

        LearningOutcome outcome = service.recordVerdict(input(verdict(true)));

        assertThat(outcome.triggeredRuleIds()).isEmpty();
        assertThat(other.getHealth()).isEqualTo(95);
        verify(ruleRepo).save(other);
    }

    @Test
    void recordVerdict_conditionsDoNotMatch_ruleNotEvaluated() {
        PolicyRule kitchenOnly = rule(RuleScope.ACTOR, "3:missing_space:island missing", NOW);
        kitchenOnly.setContextConditions("{\"space_categories\":[\"kitchen\"]}");
        when(ruleRepo.findApplicable(RUN, OWNER, STEP)).thenReturn(List.of(kitchenOnly));

        service.recordVerdict(input(verdict(true)));

        assertThat(kitchenOnly.getHealth()).isEqualTo(100);
        verify(ruleRepo, never()).save(any());
    }

    @Test
    void recordFalsePositive_rebooksRejectionAndDemotes() {
        PolicyRule guard = rule(RuleScope.ACTOR, NO_BED_KEY, NOW);
        guard.setStrengthStage(StrengthStage.GUARD);
        guard.setHealth(50);
        guard.setTriggeredCount(3);
        guard.setRejectedDueToTrigger(3);
        when(ruleRepo.findById(guard.getId())).thenReturn(Optional.of(guard));

        service.recordFalsePositive(List.of(guard.getId()), "reviewer", "bed is behind the door");

        assertThat(guard.getRejectedDueToTrigger()).isEqualTo(2);
        assertThat(guard.getApprovedDespiteTrigger()).isEqualTo(1);
        assertThat(guard.getHealth()).isEqualTo(20);
        assertThat(guard.getStrengthStage()).isEqualTo(StrengthStage.CHECK);
        assertThat(loggedTypes()).containsExactly(PromotionType.DEMOTED);
    }

    // -------------------------------------------------------------------------
    // Overrides
    // -------------------------------------------------------------------------

    @Test
    void applyOverride_promoteCappedRule_refused() {
        PolicyRule capped = rule(RuleScope.ACTOR, NO_BED_KEY, NOW);
        capped.setConfidenceCapped(true);
        when(ruleRepo.findById(capped.getId())).thenReturn(Optional.of(capped));

        assertThatThrownBy(() -> service.applyOverride(capped.getId(), RuleOverride.PROMOTE_TO_LAW, "lead", null))
                .isInstanceOf(RuleOverrideException.class)
                .extracting(e -> ((RuleOverrideException) e).getKind())
                .isEqualTo(RuleOverrideException.Kind.CONFIDENCE_CAPPED);
        assertThat(capped.getStrengthStage()).isEqualTo(StrengthStage.NUDGE);
        verify(promotionLog, never()).save(any());
    }

    @Test
    void applyOverride_promoteDisabledRule_refused() {
        PolicyRule disabled = rule(RuleScope.ACTOR, NO_BED_KEY, NOW);
        disabled.setDisabled(true);
        when(ruleRepo.findById(disabled.getId())).thenReturn(Optional.of(disabled));

        assertThatThrownBy(() -> service.applyOverride(disabled.getId(), RuleOverride.PROMOTE_TO_LAW, "lead", null))
                .isInstanceOf(RuleOverrideException.class)
                .extracting(e -> ((RuleOverrideException) e).getKind())
                .isEqualTo(RuleOverrideException.Kind.RULE_DISABLED);
    }

    @Test
    void applyOverride_promoteToLaw_loggedWithActor() {
        PolicyRule check = rule(RuleScope.ACTOR, NO_BED_KEY, NOW);
        check.setStrengthStage(StrengthStage.CHECK);
        when(ruleRepo.findById(check.getId())).thenReturn(Optional.of(check));

        PolicyRule result = service.applyOverride(check.getId(), RuleOverride.PROMOTE_TO_LAW, "lead", "house rule");

        assertThat(result.getStrengthStage()).isEqualTo(StrengthStage.LAW);
        PromotionLogEntry entry = loggedEntries().get(0);
        assertThat(entry.getActor()).isEqualTo("lead");
        assertThat(entry.getToValue()).isEqualTo("LAW");
        assertThat(entry.getTriggerReason()).isEqualTo("house rule");
    }

    @Test
    void applyOverride_mute_flagsAndLogs() {
        PolicyRule r = rule(RuleScope.ACTOR, NO_BED_KEY, NOW);
        when(ruleRepo.findById(r.getId())).thenReturn(Optional.of(r));

        service.applyOverride(r.getId(), RuleOverride.MUTE, "lead", "");

        assertThat(r.isMuted()).isTrue();
        PromotionLogEntry entry = loggedEntries().get(0);
        assertThat(entry.getPromotionType()).isEqualTo(PromotionType.USER_OVERRIDE);
        assertThat(entry.getFromValue()).isEqualTo("muted=false");
        assertThat(entry.getToValue()).isEqualTo("muted=true");
        assertThat(entry.getTriggerReason()).isEqualTo("mute");
    }

    @Test
    void applyOverride_unlock_restartsDecayClock() {
        PolicyRule r = rule(RuleScope.ACTOR, NO_BED_KEY, NOW.minus(Duration.ofDays(60)));
        r.setStrengthStage(StrengthStage.GUARD);
        r.setLocked(true);
        when(ruleRepo.findById(r.getId())).thenReturn(Optional.of(r));

        service.applyOverride(r.getId(), RuleOverride.UNLOCK, "lead", null);

        assertThat(r.isLocked()).isFalse();
        assertThat(r.getLastHealthDecayAt()).isEqualTo(NOW);
        assertThat(r.getHealth()).isEqualTo(100);
        assertThat(r.getStrengthStage()).isEqualTo(StrengthStage.GUARD);
    }

    @Test
    void applyOverride_unknownRule_notFound() {
        UUID missing = UUID.randomUUID();
        when(ruleRepo.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.applyOverride(missing, RuleOverride.LOCK, "lead", null))
                .isInstanceOf(RuleOverrideException.class)
                .extracting(e -> ((RuleOverrideException) e).getKind())
                .isEqualTo(RuleOverrideException.Kind.RULE_NOT_FOUND);
    }

    @Test
    void resetProfile_disablesEnabledActorRules() {
        PolicyRule a = rule(RuleScope.ACTOR, "k1", NOW);
        PolicyRule b = rule(RuleScope.ACTOR, "k2", NOW);
        PolicyRule c = rule(RuleScope.ACTOR, "k3", NOW);
        c.setDisabled(true);
        when(ruleRepo.findByScopeAndOwnerId(RuleScope.ACTOR, OWNER)).thenReturn(List.of(a, b, c));

        int disabled = service.resetProfile(OWNER, "owner-self");

        assertThat(disabled).isEqualTo(2);
        assertThat(a.isDisabled()).isTrue();
        assertThat(b.isDisabled()).isTrue();
        assertThat(loggedTypes()).containsExactly(
                PromotionType.DISABLED, PromotionType.DISABLED, PromotionType.PROFILE_RESET);
        assertThat(loggedEntries()).allSatisfy(e -> assertThat(e.getActor()).isEqualTo("owner-self"));
    }

    // -------------------------------------------------------------------------
    // Policy context
    // -------------------------------------------------------------------------

    @Test
    void assemblePolicyContext_appliesTimeDecayAndSkipsMuted() {
        PolicyRule quiet = rule(RuleScope.ACTOR, "k1", NOW.minus(Duration.ofDays(10)));
        PolicyRule muted = rule(RuleScope.ACTOR, "k2", NOW);
        muted.setMuted(true);
        when(ruleRepo.findApplicable(RUN, OWNER, STEP)).thenReturn(List.of(quiet, muted));

        PolicyContext ctx = service.assemblePolicyContext(RUN, OWNER, STEP);

        assertThat(ctx.rules()).extracting(PolicyContext.ActiveRule::ruleId).containsExactly(quiet.getId());
        assertThat(quiet.getHealth()).isEqualTo(80);
        assertThat(quiet.getLastHealthDecayAt()).isEqualTo(NOW);
    }

    @Test
    void decayAll_countsOnlyChangedRules() {
        PolicyRule stale = rule(RuleScope.GLOBAL, "k1", NOW.minus(Duration.ofDays(2)));
        PolicyRule fresh = rule(RuleScope.GLOBAL, "k2", NOW);
        when(ruleRepo.findByDisabledFalse()).thenReturn(List.of(stale, fresh));

        assertThat(service.decayAll()).isEqualTo(1);
        assertThat(stale.getHealth()).isEqualTo(96);
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private static PolicyRule rule(RuleScope scope, String key, Instant createdAt) {
        UUID runId = scope == RuleScope.RUN ? RUN : null;
        String owner = scope == RuleScope.GLOBAL ? null : OWNER;
        return TestEntities.withId(new PolicyRule(scope, owner, runId, STEP,
                "furniture_mismatch", "Avoid: Bedroom 2 has no bed", key, createdAt));
    }

    private static PolicyRule ownedBy(String owner) {
        return TestEntities.withId(new PolicyRule(RuleScope.ACTOR, owner, null, STEP,
                "furniture_mismatch", "Avoid: Bedroom 2 has no bed", NO_BED_KEY, NOW));
    }

    private static ComparisonVerdict verdict(boolean pass, ComparisonFailure... failures) {
        return new ComparisonVerdict(RUN, STEP, pass, "Cosy bedroom", List.of(failures), List.of(),
                pass ? NextStep.PROCEED : NextStep.RETRY, 120L, "judge-model");
    }

    private static LearningInput input(ComparisonVerdict verdict) {
        return new LearningInput(RUN, OWNER, STEP, verdict, Map.of("s1", "bedroom"));
    }

    private List<PromotionLogEntry> loggedEntries() {
        ArgumentCaptor<PromotionLogEntry> captor = ArgumentCaptor.forClass(PromotionLogEntry.class);
        verify(promotionLog, atLeastOnce()).save(captor.capture());
        return captor.getAllValues();
    }

    private List<PromotionType> loggedTypes() {
        return loggedEntries().stream().map(PromotionLogEntry::getPromotionType).toList();
    }
}
