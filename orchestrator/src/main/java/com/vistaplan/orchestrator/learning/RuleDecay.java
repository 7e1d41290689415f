package com.vistaplan.orchestrator.learning;

import com.vistaplan.orchestrator.model.StrengthStage;

import java.time.Duration;
import java.time.Instant;

/**
 * Health arithmetic for learned rules. Pure functions; the caller supplies "now".
 *
 * <pre>
 *   time decay       2 per full day since the last decay
 *   good behaviour   5 per passing task where the rule was checked but not triggered
 *   false positive  30 when a triggered rule's artifact is approved anyway
 * </pre>
 * After each application at most one demotion happens: GUARD → CHECK at
 * health ≤ 30, CHECK → NUDGE at ≤ 15. Health 0 disables the rule. LAW is never
 * demoted by health. Locked rules are exempt from everything here, and muted
 * rules from time decay.
 */
public final class RuleDecay {

    public static final int TIME_DECAY_PER_DAY   = 2;
    public static final int GOOD_BEHAVIOR_DECAY  = 5;
    public static final int FALSE_POSITIVE_DECAY = 30;

    static final int GUARD_FLOOR = 30;
    static final int CHECK_FLOOR = 15;

    /** @param demotedFrom stage before the demotion, or null */
    public record Result(RuleVitals vitals, StrengthStage demotedFrom, boolean disabledNow) {

        public boolean changed(RuleVitals before) {
            return !vitals.equals(before);
        }
    }

    private RuleDecay() {}

    /**
     * Locked and muted rules keep their health, but their decay clock still
     * advances, so an exempt period is never charged after the flag is cleared.
     */
    public static Result timeDecay(RuleVitals v, Instant now) {
        if (v.disabled() || v.lastDecayAt() == null) return unchanged(v);
        long days = Duration.between(v.lastDecayAt(), now).toDays();
        if (days < 1) return unchanged(v);
        // Advance by whole days so partial days carry over to the next read.
        RuleVitals advanced = v.withLastDecayAt(v.lastDecayAt().plus(Duration.ofDays(days)));
        if (v.locked() || v.muted()) return unchanged(advanced);
        long amount = Math.min(100L, days * TIME_DECAY_PER_DAY);
        return penalize(advanced, (int) amount);
    }

    public static Result goodBehavior(RuleVitals v) {
        if (v.locked() || v.disabled()) return unchanged(v);
        return penalize(v, GOOD_BEHAVIOR_DECAY);
    }

    public static Result falsePositive(RuleVitals v) {
        if (v.locked() || v.disabled()) return unchanged(v);
        return penalize(v, FALSE_POSITIVE_DECAY);
    }

    static Result penalize(RuleVitals v, int amount) {
        int health = Math.max(0, v.health() - amount);
        RuleVitals out = v.withHealth(health);

        StrengthStage demotedFrom = null;
        if (v.stage() == StrengthStage.GUARD && health <= GUARD_FLOOR) {
            out = out.withStage(StrengthStage.CHECK);
            demotedFrom = StrengthStage.GUARD;
        } else if (v.stage() == StrengthStage.CHECK && health <= CHECK_FLOOR) {
            out = out.withStage(StrengthStage.NUDGE);
            demotedFrom = StrengthStage.CHECK;
        }

        boolean disabledNow = health == 0 && !v.disabled();
        if (disabledNow) out = out.withDisabled(true);
        return new Result(out, demotedFrom, disabledNow);
    }

    private static Result unchanged(RuleVitals v) {
        return new Result(v, null, false);
    }
}
