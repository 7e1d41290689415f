package com.vistaplan.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One row per (rule key, owner, run): the violation showed up in that run.
 *
 * Scope promotion counts distinct runs here, so a violation repeated twenty
 * times inside one run still counts once.
 *
 * DB table: rule_occurrences  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "rule_occurrences",
       uniqueConstraints = @UniqueConstraint(columnNames = {"rule_key", "owner_id", "run_id"}))
public class RuleOccurrence {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "rule_key", nullable = false)
    private String ruleKey;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "occurrences", nullable = false)
    private int occurrences = 1;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    @Column(name = "last_seen_at", nullable = false)
    private Instant lastSeenAt;

    protected RuleOccurrence() {}   // required by JPA

    public RuleOccurrence(String ruleKey, String ownerId, UUID runId, Instant now) {
        this.ruleKey     = ruleKey;
        this.ownerId     = ownerId;
        this.runId       = runId;
        this.firstSeenAt = now;
        this.lastSeenAt  = now;
    }

    public UUID    getId()          { return id; }
    public String  getRuleKey()     { return ruleKey; }
    public String  getOwnerId()     { return ownerId; }
    public UUID    getRunId()       { return runId; }
    public int     getOccurrences() { return occurrences; }
    public Instant getFirstSeenAt() { return firstSeenAt; }
    public Instant getLastSeenAt()  { return lastSeenAt; }

    public void recordAgain(Instant now) {
        this.occurrences++;
        this.lastSeenAt = now;
    }
}
