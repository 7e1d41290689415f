package com.vistaplan.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One end-to-end pipeline execution for one uploaded floor plan.
 *
 * Every write to a run goes through PhaseTransitionService. phase and
 * currentStep are only written together, by the conditional update in
 * PipelineRunRepository, so they have no public setters.
 *
 * DB table: pipeline_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_runs")
public class PipelineRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Phase phase = Phase.UPLOAD;

    @Column(name = "current_step", nullable = false)
    private int currentStep = 0;

    // Requested output tier ("1K" | "2K" | "4K"). Steps 0-3 always use 2K.
    @Enumerated(EnumType.STRING)
    @Column(name = "quality_tier", nullable = false)
    private QualityTier qualityTier = QualityTier.Q2K;

    // Free-text request from the user, forwarded to the semantic judge.
    @Column(name = "user_request", columnDefinition = "TEXT")
    private String userRequest;

    @Column(name = "style_constraints", columnDefinition = "TEXT")
    private String styleConstraints;

    // JSON object keyed by step number; each value is a StepOutput variant.
    @Column(name = "step_outputs", columnDefinition = "TEXT", nullable = false)
    private String stepOutputs = "{}";

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(nullable = false)
    private boolean paused = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PipelineRun() {}   // required by JPA

    public PipelineRun(String ownerId, QualityTier qualityTier) {
        this.ownerId     = ownerId;
        this.qualityTier = qualityTier;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID        getId()               { return id; }
    public String      getOwnerId()          { return ownerId; }
    public Phase       getPhase()            { return phase; }
    public int         getCurrentStep()      { return currentStep; }
    public QualityTier getQualityTier()      { return qualityTier; }
    public String      getUserRequest()      { return userRequest; }
    public String      getStyleConstraints() { return styleConstraints; }
    public String      getStepOutputs()      { return stepOutputs; }
    public String      getLastError()        { return lastError; }
    public boolean     isPaused()            { return paused; }
    public Instant     getCreatedAt()        { return createdAt; }
    public Instant     getUpdatedAt()        { return updatedAt; }

    public void setUserRequest(String v)      { this.userRequest = v; }
    public void setStyleConstraints(String v) { this.styleConstraints = v; }
    public void setStepOutputs(String v)      { this.stepOutputs = v; }
    public void setLastError(String v)        { this.lastError = v; }
    public void setPaused(boolean paused)     { this.paused = paused; }

    /** Mirrors a committed transition onto an already-loaded instance. */
    public void applyCommittedPhase(Phase phase) {
        this.phase       = phase;
        this.currentStep = phase.step();
    }
}
