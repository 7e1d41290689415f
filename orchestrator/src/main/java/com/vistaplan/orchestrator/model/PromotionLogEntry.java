package com.vistaplan.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Shared audit trail for rule escalations and for human decisions on jobs.
 *
 * Both kinds land in the same table so a reviewer can line up "rule X became a
 * GUARD" with "job Y was approved despite it".
 *
 * DB table: promotion_log  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "promotion_log")
public class PromotionLogEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "promotion_type", nullable = false, updatable = false)
    private PromotionType promotionType;

    @Column(name = "rule_id", updatable = false)
    private UUID ruleId;

    @Column(name = "job_id", updatable = false)
    private UUID jobId;

    @Column(name = "run_id", updatable = false)
    private UUID runId;

    @Column(name = "owner_id", updatable = false)
    private String ownerId;

    @Column(name = "from_value", updatable = false)
    private String fromValue;

    @Column(name = "to_value", updatable = false)
    private String toValue;

    @Column(name = "trigger_reason", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String triggerReason;

    @Column(name = "rule_text", columnDefinition = "TEXT", updatable = false)
    private String ruleText;

    @Column(name = "violation_count", updatable = false)
    private Integer violationCount;

    @Column(name = "health", updatable = false)
    private Integer health;

    @Column(name = "confidence_score", updatable = false)
    private Double confidenceScore;

    @Column(name = "actor", updatable = false)
    private String actor;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected PromotionLogEntry() {}   // required by JPA

    private PromotionLogEntry(PromotionType type, String triggerReason, Instant now) {
        this.promotionType = type;
        this.triggerReason = triggerReason;
        this.createdAt     = now;
    }

    /** Entry describing a change to a rule; snapshots the rule's counters. */
    public static PromotionLogEntry forRule(PolicyRule rule, PromotionType type,
                                            String fromValue, String toValue,
                                            String reason, Instant now) {
        PromotionLogEntry e = new PromotionLogEntry(type, reason, now);
        e.ruleId          = rule.getId();
        e.runId           = rule.getRunId();
        e.ownerId         = rule.getOwnerId();
        e.fromValue       = fromValue;
        e.toValue         = toValue;
        e.ruleText        = rule.getRuleText();
        e.violationCount  = rule.getViolationCount();
        e.health          = rule.getHealth();
        e.confidenceScore = rule.getConfidenceScore();
        return e;
    }

    /** Entry describing a human decision on a blocked or reviewed job. */
    public static PromotionLogEntry forJobDecision(PipelineJob job, String ownerId, PromotionType type,
                                                   JobStatus from, String actor, String reason, Instant now) {
        PromotionLogEntry e = new PromotionLogEntry(type, reason, now);
        e.jobId     = job.getId();
        e.runId     = job.getRunId();
        e.ownerId   = ownerId;
        e.fromValue = from.name();
        e.toValue   = job.getStatus().name();
        e.actor     = actor;
        return e;
    }

    /** Entry describing an action on an owner's whole profile. */
    public static PromotionLogEntry forOwner(String ownerId, PromotionType type,
                                             String actor, String reason, Instant now) {
        PromotionLogEntry e = new PromotionLogEntry(type, reason, now);
        e.ownerId = ownerId;
        e.actor   = actor;
        return e;
    }

    /** Set before saving; the column is not updatable. */
    public PromotionLogEntry withActor(String actor) {
        this.actor = actor;
        return this;
    }

    public UUID          getId()              { return id; }
    public PromotionType getPromotionType()   { return promotionType; }
    public UUID          getRuleId()          { return ruleId; }
    public UUID          getJobId()           { return jobId; }
    public UUID          getRunId()           { return runId; }
    public String        getOwnerId()         { return ownerId; }
    public String        getFromValue()       { return fromValue; }
    public String        getToValue()         { return toValue; }
    public String        getTriggerReason()   { return triggerReason; }
    public String        getRuleText()        { return ruleText; }
    public Integer       getViolationCount()  { return violationCount; }
    public Integer       getHealth()          { return health; }
    public Double        getConfidenceScore() { return confidenceScore; }
    public String        getActor()           { return actor; }
    public Instant       getCreatedAt()       { return createdAt; }
}
