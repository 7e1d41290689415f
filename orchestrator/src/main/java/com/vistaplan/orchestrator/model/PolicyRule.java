package com.vistaplan.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * A learned negative constraint ("don't do X at step N").
 *
 * Created run-local on the first violation, then promoted to the owner's
 * profile and finally to every run as the same violation recurs in
 * independent runs. Strength, health and confidence are maintained by
 * ProgressiveLearningService; the arithmetic lives in RuleDecay and
 * StrengthCalculator.
 *
 * DB table: policy_rules  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "policy_rules")
public class PolicyRule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RuleScope scope;

    // Null for GLOBAL rules.
    @Column(name = "owner_id")
    private String ownerId;

    // Only set for RUN-scoped rules.
    @Column(name = "run_id")
    private UUID runId;

    @Column(nullable = false)
    private int step;

    // Failure type wire name, e.g. "furniture_mismatch".
    @Column(nullable = false)
    private String category;

    @Column(name = "rule_text", columnDefinition = "TEXT", nullable = false)
    private String ruleText;

    // Normalized identity of the violation; shared by the same rule at every scope.
    @Column(name = "rule_key", nullable = false)
    private String ruleKey;

    @Column(name = "violation_count", nullable = false)
    private int violationCount = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "strength_stage", nullable = false)
    private StrengthStage strengthStage = StrengthStage.NUDGE;

    @Column(nullable = false)
    private int health = 100;

    @Column(name = "confidence_score", nullable = false)
    private double confidenceScore = 1.0;

    @Column(name = "triggered_count", nullable = false)
    private int triggeredCount = 0;

    @Column(name = "rejected_due_to_trigger", nullable = false)
    private int rejectedDueToTrigger = 0;

    @Column(name = "approved_despite_trigger", nullable = false)
    private int approvedDespiteTrigger = 0;

    // Once set the rule stays at NUDGE for good.
    @Column(name = "confidence_capped", nullable = false)
    private boolean confidenceCapped = false;

    // JSON RuleConditions: where the rule applies.
    @Column(name = "context_conditions", columnDefinition = "TEXT")
    private String contextConditions;

    @Column(nullable = false)
    private boolean muted = false;

    @Column(nullable = false)
    private boolean locked = false;

    @Column(nullable = false)
    private boolean disabled = false;

    @Column(name = "last_triggered_at")
    private Instant lastTriggeredAt;

    @Column(name = "last_health_decay_at", nullable = false)
    private Instant lastHealthDecayAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PolicyRule() {}   // required by JPA

    public PolicyRule(RuleScope scope, String ownerId, UUID runId, int step,
                      String category, String ruleText, String ruleKey, Instant now) {
        this.scope             = scope;
        this.ownerId           = ownerId;
        this.runId             = runId;
        this.step              = step;
        this.category          = category;
        this.ruleText          = ruleText;
        this.ruleKey           = ruleKey;
        this.lastHealthDecayAt = now;
        this.createdAt         = now;
        this.updatedAt         = now;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()                     { return id; }
    public RuleScope     getScope()                  { return scope; }
    public String        getOwnerId()                { return ownerId; }
    public UUID          getRunId()                  { return runId; }
    public int           getStep()                   { return step; }
    public String        getCategory()               { return category; }
    public String        getRuleText()               { return ruleText; }
    public String        getRuleKey()                { return ruleKey; }
    public int           getViolationCount()         { return violationCount; }
    public StrengthStage getStrengthStage()          { return strengthStage; }
    public int           getHealth()                 { return health; }
    public double        getConfidenceScore()        { return confidenceScore; }
    public int           getTriggeredCount()         { return triggeredCount; }
    public int           getRejectedDueToTrigger()   { return rejectedDueToTrigger; }
    public int           getApprovedDespiteTrigger() { return approvedDespiteTrigger; }
    public boolean       isConfidenceCapped()        { return confidenceCapped; }
    public String        getContextConditions()      { return contextConditions; }
    public boolean       isMuted()                   { return muted; }
    public boolean       isLocked()                  { return locked; }
    public boolean       isDisabled()                { return disabled; }
    public Instant       getLastTriggeredAt()        { return lastTriggeredAt; }
    public Instant       getLastHealthDecayAt()      { return lastHealthDecayAt; }
    public Instant       getCreatedAt()              { return createdAt; }
    public Instant       getUpdatedAt()              { return updatedAt; }

    public void setRuleText(String v)                 { this.ruleText = v; }
    public void setViolationCount(int v)              { this.violationCount = v; }
    public void setStrengthStage(StrengthStage v)     { this.strengthStage = v; }
    public void setHealth(int v)                      { this.health = v; }
    public void setConfidenceScore(double v)          { this.confidenceScore = v; }
    public void setTriggeredCount(int v)              { this.triggeredCount = v; }
    public void setRejectedDueToTrigger(int v)        { this.rejectedDueToTrigger = v; }
    public void setApprovedDespiteTrigger(int v)      { this.approvedDespiteTrigger = v; }
    public void setConfidenceCapped(boolean v)        { this.confidenceCapped = v; }
    public void setContextConditions(String v)        { this.contextConditions = v; }
    public void setMuted(boolean v)                   { this.muted = v; }
    public void setLocked(boolean v)                  { this.locked = v; }
    public void setDisabled(boolean v)                { this.disabled = v; }
    public void setLastTriggeredAt(Instant t)         { this.lastTriggeredAt = t; }
    public void setLastHealthDecayAt(Instant t)       { this.lastHealthDecayAt = t; }

    /** Disabled and muted rules never take part in trigger evaluation. */
    public boolean isEvaluable() {
        return !disabled && !muted;
    }
}
