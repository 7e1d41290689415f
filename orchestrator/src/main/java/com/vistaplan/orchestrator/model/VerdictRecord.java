package com.vistaplan.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted ComparisonVerdict for one job attempt, kept for audit and for
 * best-attempt selection once a job's budget runs out.
 *
 * DB table: comparison_verdicts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "comparison_verdicts")
public class VerdictRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(name = "artifact_id", updatable = false)
    private UUID artifactId;

    @Column(nullable = false, updatable = false)
    private int step;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Column(nullable = false, updatable = false)
    private boolean pass;

    @Column(name = "next_step", nullable = false, updatable = false)
    private String nextStep;

    @Column(name = "critical_count", nullable = false, updatable = false)
    private int criticalCount;

    @Column(name = "high_count", nullable = false, updatable = false)
    private int highCount;

    @Column(name = "failure_count", nullable = false, updatable = false)
    private int failureCount;

    // Full ComparisonVerdict as JSON.
    @Column(name = "verdict_json", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String verdictJson;

    // JSON array of policy rule ids that fired on this attempt.
    @Column(name = "triggered_rule_ids", columnDefinition = "TEXT", updatable = false)
    private String triggeredRuleIds;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected VerdictRecord() {}   // required by JPA

    public VerdictRecord(UUID runId, UUID jobId, UUID artifactId, int step, int attempt,
                         boolean pass, String nextStep, int criticalCount, int highCount,
                         int failureCount, String verdictJson, String triggeredRuleIds) {
        this.runId            = runId;
        this.jobId            = jobId;
        this.artifactId       = artifactId;
        this.step             = step;
        this.attempt          = attempt;
        this.pass             = pass;
        this.nextStep         = nextStep;
        this.criticalCount    = criticalCount;
        this.highCount        = highCount;
        this.failureCount     = failureCount;
        this.verdictJson      = verdictJson;
        this.triggeredRuleIds = triggeredRuleIds;
    }

    public UUID    getId()               { return id; }
    public UUID    getRunId()            { return runId; }
    public UUID    getJobId()            { return jobId; }
    public UUID    getArtifactId()       { return artifactId; }
    public int     getStep()             { return step; }
    public int     getAttempt()          { return attempt; }
    public boolean isPass()              { return pass; }
    public String  getNextStep()         { return nextStep; }
    public int     getCriticalCount()    { return criticalCount; }
    public int     getHighCount()        { return highCount; }
    public int     getFailureCount()     { return failureCount; }
    public String  getVerdictJson()      { return verdictJson; }
    public String  getTriggeredRuleIds() { return triggeredRuleIds; }
    public Instant getCreatedAt()        { return createdAt; }
}
