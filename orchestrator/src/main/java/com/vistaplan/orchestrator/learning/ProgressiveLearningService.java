package com.vistaplan.orchestrator.learning;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import com.vistaplan.orchestrator.validation.FailureType;
import com.vistaplan.orchestrator.validation.PolicyContext;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns repeated judge rejections into progressively stricter rules, and lets
 * them fade again when they stop earning their keep.
 *
 * Lifecycle of a rule key:
 *  1. First rejection in a run      → RUN rule at NUDGE
 *  2. Same key in 3 runs of an owner → ACTOR rule
 *  3. ACTOR rule held by 3 owners across 5 runs → GLOBAL rule
 * Along the way each violation raises the violation count (NUDGE → CHECK → GUARD)
 * and each trigger feeds the confidence score. Health decays over time, on
 * passing tasks where the rule did not fire, and on false positives.
 *
 * Every change to a rule writes a PromotionLogEntry in the same transaction.
 */
@Service
public class ProgressiveLearningService {

    private static final Logger log = LoggerFactory.getLogger(ProgressiveLearningService.class);

    static final int ACTOR_PROMOTION_RUNS   = 3;
    static final int GLOBAL_PROMOTION_OWNERS = 3;
    static final int GLOBAL_PROMOTION_RUNS   = 5;

    // Collaborator outages say nothing about the artifact.
    private static final Set<FailureType> NOT_LEARNABLE =
            EnumSet.of(FailureType.TIMEOUT, FailureType.API_ERROR);

    private final PolicyRuleRepository     ruleRepo;
    private final RuleOccurrenceRepository occurrenceRepo;
    private final PromotionLogRepository   promotionLog;
    private final ObjectMapper             objectMapper;
    private final MeterRegistry            meterRegistry;
    private final Clock                    clock;

    public ProgressiveLearningService(PolicyRuleRepository ruleRepo,
                                      RuleOccurrenceRepository occurrenceRepo,
                                      PromotionLogRepository promotionLog,
                                      ObjectMapper objectMapper,
                                      MeterRegistry meterRegistry,
                                      Clock clock) {
        this.ruleRepo       = ruleRepo;
        this.occurrenceRepo = occurrenceRepo;
        this.promotionLog   = promotionLog;
        this.objectMapper   = objectMapper;
        this.meterRegistry  = meterRegistry;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Policy context
    // ------------------------------------------------------------------

    /**
     * Rules to hand to generation and validation for one job. Time decay is
     * applied here, so a rule that went quiet for weeks is weaker (or gone)
     * by the time anyone reads it.
     */
    @Transactional
    public PolicyContext assemblePolicyContext(UUID runId, String ownerId, int step) {
        Instant now = clock.instant();
        List<PolicyContext.ActiveRule> active = new ArrayList<>();
        for (PolicyRule rule : ruleRepo.findApplicable(runId, ownerId, step)) {
            applyTimeDecay(rule, now);
            if (rule.isEvaluable()) {
                active.add(new PolicyContext.ActiveRule(
                        rule.getId(), rule.getCategory(), rule.getRuleText(), rule.getStrengthStage()));
            }
        }
        return new PolicyContext(active);
    }

    // ------------------------------------------------------------------
    // Verdicts
    // ------------------------------------------------------------------

    /**
     * Learn from one validated attempt.
     *
     * Existing rules whose key matches a failure are "triggered"; a trigger on
     * a rejected attempt counts toward confidence. On a passing attempt,
     * evaluated rules that did not trigger lose a little health. Failures of a
     * rejected attempt become violations: they create or strengthen rules and
     * may promote them to a wider scope.
     */
    @Transactional
    public LearningOutcome recordVerdict(LearningInput in) {
        Instant now      = clock.instant();
        boolean rejected = !in.verdict().pass();

        Map<String, ComparisonFailure> byKey = new LinkedHashMap<>();
        for (ComparisonFailure f : in.verdict().failures()) {
            if (!NOT_LEARNABLE.contains(f.type())) {
                byKey.putIfAbsent(RuleKeys.keyFor(in.step(), f), f);
            }
        }
        Set<String> present = new HashSet<>(in.categoriesBySpaceId().values());

        List<UUID> triggered = new ArrayList<>();
        for (PolicyRule rule : ruleRepo.findApplicable(in.runId(), in.ownerId(), in.step())) {
            applyTimeDecay(rule, now);
            if (!rule.isEvaluable() || !conditionsOf(rule).matches(present)) continue;

            if (byKey.containsKey(rule.getRuleKey())) {
                trigger(rule, rejected, now);
                triggered.add(rule.getId());
            } else if (!rejected) {
                applyDecay(rule, RuleDecay.goodBehavior(RuleVitals.of(rule)),
                        "passed without triggering", now);
            }
        }

        List<UUID> created = new ArrayList<>();
        if (rejected) {
            byKey.forEach((key, failure) -> recordViolation(in, key, failure, now, created));
        }

        if (!triggered.isEmpty() || !created.isEmpty()) {
            log.info("Learning for run {} step {}: triggered={} created={}",
                    in.runId(), in.step(), triggered.size(), created.size());
        }
        return new LearningOutcome(triggered, created);
    }

    /**
     * A human approved an artifact the judge rejected. Every rule that fired on
     * it was wrong this time: the rejection is re-booked as an approval and the
     * rule takes the false-positive penalty.
     */
    @Transactional
    public void recordFalsePositive(Collection<UUID> ruleIds, String actor, String reason) {
        Instant now = clock.instant();
        for (UUID ruleId : ruleIds) {
            PolicyRule rule = ruleRepo.findById(ruleId).orElse(null);
            if (rule == null || rule.isDisabled()) continue;

            rule.setApprovedDespiteTrigger(rule.getApprovedDespiteTrigger() + 1);
            rule.setRejectedDueToTrigger(Math.max(0, rule.getRejectedDueToTrigger() - 1));
            recomputeConfidence(rule, now);
            applyDecay(rule, RuleDecay.falsePositive(RuleVitals.of(rule)),
                    "false positive: " + reason, now);
            ruleRepo.save(rule);
            log.info("Rule {} marked false positive by {} (health={})", ruleId, actor, rule.getHealth());
        }
    }

    // ------------------------------------------------------------------
    // Manual overrides
    // ------------------------------------------------------------------

    @Transactional
    public PolicyRule applyOverride(UUID ruleId, RuleOverride override, String actor, String reason) {
        PolicyRule rule = ruleRepo.findById(ruleId)
                .orElseThrow(() -> new RuleOverrideException(
                        RuleOverrideException.Kind.RULE_NOT_FOUND, ruleId, "no such rule"));
        Instant now = clock.instant();
        String why = reason == null || reason.isBlank() ? override.name().toLowerCase(Locale.ROOT) : reason;

        switch (override) {
            case MUTE    -> flag(rule, "muted", rule.isMuted(), true, actor, why, now);
            case UNMUTE  -> flag(rule, "muted", rule.isMuted(), false, actor, why, now);
            case LOCK    -> flag(rule, "locked", rule.isLocked(), true, actor, why, now);
            case UNLOCK  -> flag(rule, "locked", rule.isLocked(), false, actor, why, now);
            case PROMOTE_TO_LAW -> promoteToLaw(rule, actor, why, now);
        }
        meterRegistry.counter("vistaplan.rules.overrides", "override", override.name()).increment();
        return ruleRepo.save(rule);
    }

    private void promoteToLaw(PolicyRule rule, String actor, String reason, Instant now) {
        if (rule.isDisabled()) {
            throw new RuleOverrideException(RuleOverrideException.Kind.RULE_DISABLED,
                    rule.getId(), "disabled rules cannot be promoted");
        }
        if (rule.isConfidenceCapped()) {
            throw new RuleOverrideException(RuleOverrideException.Kind.CONFIDENCE_CAPPED,
                    rule.getId(), "confidence " + rule.getConfidenceScore() + " is below the floor");
        }
        StrengthStage from = rule.getStrengthStage();
        if (from == StrengthStage.LAW) return;
        rule.setStrengthStage(StrengthStage.LAW);
        logRule(rule, PromotionType.ESCALATED, from.name(), StrengthStage.LAW.name(), reason, actor, now);
    }

    private void flag(PolicyRule rule, String name, boolean before, boolean after,
                      String actor, String reason, Instant now) {
        if (before == after) return;
        if (name.equals("muted")) rule.setMuted(after);
        else                      rule.setLocked(after);
        // Decay restarts from the moment the exemption ends.
        if (!after) rule.setLastHealthDecayAt(now);
        logRule(rule, PromotionType.USER_OVERRIDE,
                name + "=" + before, name + "=" + after, reason, actor, now);
    }

    /**
     * "Fresh start": disables every ACTOR rule the owner has accumulated.
     * Run-local and global rules are untouched.
     *
     * @return number of rules disabled
     */
    @Transactional
    public int resetProfile(String ownerId, String actor) {
        Instant now = clock.instant();
        int disabled = 0;
        for (PolicyRule rule : ruleRepo.findByScopeAndOwnerId(RuleScope.ACTOR, ownerId)) {
            if (rule.isDisabled()) continue;
            rule.setDisabled(true);
            ruleRepo.save(rule);
            logRule(rule, PromotionType.DISABLED, "enabled", "disabled", "profile reset", actor, now);
            disabled++;
        }
        promotionLog.save(PromotionLogEntry.forOwner(ownerId, PromotionType.PROFILE_RESET, actor,
                "disabled " + disabled + " rules", now));
        log.info("Reset learning profile of {} ({} rules disabled)", ownerId, disabled);
        return disabled;
    }

    // ------------------------------------------------------------------
    // Daily sweep
    // ------------------------------------------------------------------

    /** Applies time decay to every enabled rule. Returns how many changed. */
    @Transactional
    public int decayAll() {
        Instant now = clock.instant();
        int changed = 0;
        for (PolicyRule rule : ruleRepo.findByDisabledFalse()) {
            if (applyTimeDecay(rule, now)) changed++;
        }
        return changed;
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private void recordViolation(LearningInput in, String key, ComparisonFailure failure,
                                 Instant now, List<UUID> created) {
        PolicyRule runRule = ruleRepo.findByScopeAndRunIdAndRuleKey(RuleScope.RUN, in.runId(), key)
                .orElse(null);
        if (runRule == null) {
            runRule = newRule(RuleScope.RUN, in.ownerId(), in.runId(), in.step(), key, failure,
                    categoryOf(in, failure), now);
            logRule(runRule, PromotionType.CREATED, null, RuleScope.RUN.name(),
                    failure.type().wireName() + ": " + failure.description(), now);
            created.add(runRule.getId());
        }
        escalate(runRule, now);

        ruleRepo.findByScopeAndOwnerIdAndRuleKey(RuleScope.ACTOR, in.ownerId(), key)
                .ifPresent(r -> escalate(r, now));
        ruleRepo.findByScopeAndRuleKey(RuleScope.GLOBAL, key)
                .ifPresent(r -> escalate(r, now));

        occurrenceRepo.findByRuleKeyAndOwnerIdAndRunId(key, in.ownerId(), in.runId())
                .ifPresentOrElse(o -> o.recordAgain(now),
                        () -> occurrenceRepo.save(new RuleOccurrence(key, in.ownerId(), in.runId(), now)));

        promoteScope(in, key, failure, runRule, now, created);
    }

    private void promoteScope(LearningInput in, String key, ComparisonFailure failure,
                              PolicyRule runRule, Instant now, List<UUID> created) {
        if (ruleRepo.findByScopeAndOwnerIdAndRuleKey(RuleScope.ACTOR, in.ownerId(), key).isEmpty()) {
            long runs = occurrenceRepo.countDistinctRuns(key, in.ownerId());
            if (runs < ACTOR_PROMOTION_RUNS) return;

            PolicyRule actorRule = newRule(RuleScope.ACTOR, in.ownerId(), null, in.step(), key, failure,
                    runRule.getContextConditions(), now);
            seedCount(actorRule, (int) runs);
            logRule(actorRule, PromotionType.SCOPE_PROMOTED, RuleScope.RUN.name(), RuleScope.ACTOR.name(),
                    "seen in " + runs + " runs of " + in.ownerId(), now);
            created.add(actorRule.getId());
        }

        if (ruleRepo.findByScopeAndRuleKey(RuleScope.GLOBAL, key).isPresent()) return;

        long owners = ruleRepo.findByScopeAndRuleKeyAndDisabledFalse(RuleScope.ACTOR, key).stream()
                .map(PolicyRule::getOwnerId)
                .distinct()
                .count();
        if (owners < GLOBAL_PROMOTION_OWNERS) return;
        long runs = occurrenceRepo.countDistinctRunsAllOwners(key);
        if (runs < GLOBAL_PROMOTION_RUNS) return;

        PolicyRule globalRule = newRule(RuleScope.GLOBAL, null, null, in.step(), key, failure,
                runRule.getContextConditions(), now);
        seedCount(globalRule, (int) runs);
        logRule(globalRule, PromotionType.SCOPE_PROMOTED, RuleScope.ACTOR.name(), RuleScope.GLOBAL.name(),
                "held by " + owners + " owners across " + runs + " runs", now);
        created.add(globalRule.getId());
    }

    private PolicyRule newRule(RuleScope scope, String ownerId, UUID runId, int step, String key,
                               ComparisonFailure failure, String conditionsJson, Instant now) {
        PolicyRule rule = new PolicyRule(scope, ownerId, runId, step,
                failure.type().wireName(), RuleKeys.ruleTextFor(failure), key, now);
        rule.setContextConditions(conditionsJson);
        meterRegistry.counter("vistaplan.rules.created", "scope", scope.name()).increment();
        return ruleRepo.save(rule);
    }

    private void seedCount(PolicyRule rule, int violations) {
        rule.setViolationCount(violations);
        rule.setStrengthStage(StrengthCalculator.stageForViolations(violations));
    }

    private void escalate(PolicyRule rule, Instant now) {
        if (rule.isDisabled()) return;
        int count = rule.getViolationCount() + 1;
        rule.setViolationCount(count);
        StrengthStage from = rule.getStrengthStage();
        StrengthStage to   = StrengthCalculator.afterViolation(from, count, rule.isConfidenceCapped());
        if (to != from) {
            rule.setStrengthStage(to);
            logRule(rule, PromotionType.ESCALATED, from.name(), to.name(), count + " violations", now);
        }
    }

    private void trigger(PolicyRule rule, boolean rejected, Instant now) {
        rule.setTriggeredCount(rule.getTriggeredCount() + 1);
        if (rejected) rule.setRejectedDueToTrigger(rule.getRejectedDueToTrigger() + 1);
        else          rule.setApprovedDespiteTrigger(rule.getApprovedDespiteTrigger() + 1);
        rule.setLastTriggeredAt(now);
        recomputeConfidence(rule, now);
    }

    private void recomputeConfidence(PolicyRule rule, Instant now) {
        double confidence = StrengthCalculator.confidence(
                rule.getTriggeredCount(), rule.getRejectedDueToTrigger());
        rule.setConfidenceScore(confidence);

        if (!rule.isConfidenceCapped()
                && StrengthCalculator.belowConfidenceFloor(rule.getTriggeredCount(), confidence)) {
            StrengthStage from = rule.getStrengthStage();
            rule.setConfidenceCapped(true);
            rule.setStrengthStage(StrengthStage.NUDGE);
            logRule(rule, PromotionType.CONFIDENCE_CAPPED, from.name(), StrengthStage.NUDGE.name(),
                    String.format("confidence %.2f after %d triggers", confidence, rule.getTriggeredCount()), now);
        }
    }

    /** @return true if the rule changed */
    private boolean applyTimeDecay(PolicyRule rule, Instant now) {
        return applyDecay(rule, RuleDecay.timeDecay(RuleVitals.of(rule), now), "time decay", now);
    }

    private boolean applyDecay(PolicyRule rule, RuleDecay.Result result, String reason, Instant now) {
        RuleVitals before = RuleVitals.of(rule);
        if (!result.changed(before)) return false;

        result.vitals().applyTo(rule);
        if (result.demotedFrom() != null) {
            logRule(rule, PromotionType.DEMOTED, result.demotedFrom().name(),
                    rule.getStrengthStage().name(), reason + ", health " + rule.getHealth(), now);
        }
        if (result.disabledNow()) {
            logRule(rule, PromotionType.DISABLED, "enabled", "disabled", reason + ", health 0", now);
            log.info("Rule {} disabled ({})", rule.getId(), reason);
        }
        ruleRepo.save(rule);
        return true;
    }

    private void logRule(PolicyRule rule, PromotionType type, String from, String to,
                         String reason, Instant now) {
        logRule(rule, type, from, to, reason, null, now);
    }

    private void logRule(PolicyRule rule, PromotionType type, String from, String to,
                         String reason, String actor, Instant now) {
        meterRegistry.counter("vistaplan.rules.changes", "type", type.name()).increment();
        promotionLog.save(PromotionLogEntry.forRule(rule, type, from, to, reason, now).withActor(actor));
    }

    private String categoryOf(LearningInput in, ComparisonFailure failure) {
        String category = failure.affectedSpaceId() == null
                ? null
                : in.categoriesBySpaceId().get(failure.affectedSpaceId());
        return category == null ? null : writeConditions(RuleConditions.forCategory(category));
    }

    private RuleConditions conditionsOf(PolicyRule rule) {
        String json = rule.getContextConditions();
        if (json == null || json.isBlank()) return RuleConditions.always();
        try {
            return objectMapper.readValue(json, RuleConditions.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt context conditions on rule " + rule.getId(), e);
        }
    }

    private String writeConditions(RuleConditions conditions) {
        try {
            return objectMapper.writeValueAsString(conditions);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize rule conditions", e);
        }
    }
}
