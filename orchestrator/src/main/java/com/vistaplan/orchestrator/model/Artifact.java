package com.vistaplan.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Reference to an output produced by one job attempt.
 *
 * Rows are insert-only: no setters, and rejected attempts are kept so the
 * learning subsystem and human reviewers can look back at them.
 *
 * DB table: pipeline_artifacts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_artifacts")
public class Artifact {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private UUID runId;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Column(nullable = false, updatable = false)
    private int step;

    @Column(nullable = false, updatable = false)
    private int attempt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private ArtifactKind kind;

    @Column(name = "storage_ref", nullable = false, updatable = false)
    private String storageRef;

    @Column(updatable = false)
    private Integer width;

    @Column(updatable = false)
    private Integer height;

    @Column(name = "content_hash", updatable = false)
    private String contentHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "quality_tier", updatable = false)
    private QualityTier qualityTier;

    // Space-analysis document that came with the artifact, when the step produces one.
    @Column(name = "analysis_json", columnDefinition = "TEXT", updatable = false)
    private String analysisJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Artifact() {}   // required by JPA

    public Artifact(UUID runId, UUID jobId, int step, int attempt, ArtifactKind kind,
                    String storageRef, Integer width, Integer height, String contentHash,
                    QualityTier qualityTier, String analysisJson) {
        this.runId        = runId;
        this.jobId        = jobId;
        this.step         = step;
        this.attempt      = attempt;
        this.kind         = kind;
        this.storageRef   = storageRef;
        this.width        = width;
        this.height       = height;
        this.contentHash  = contentHash;
        this.qualityTier  = qualityTier;
        this.analysisJson = analysisJson;
    }

    public UUID         getId()           { return id; }
    public UUID         getRunId()        { return runId; }
    public UUID         getJobId()        { return jobId; }
    public int          getStep()         { return step; }
    public int          getAttempt()      { return attempt; }
    public ArtifactKind getKind()         { return kind; }
    public String       getStorageRef()   { return storageRef; }
    public Integer      getWidth()        { return width; }
    public Integer      getHeight()       { return height; }
    public String       getContentHash()  { return contentHash; }
    public QualityTier  getQualityTier()  { return qualityTier; }
    public String       getAnalysisJson() { return analysisJson; }
    public Instant      getCreatedAt()    { return createdAt; }
}
