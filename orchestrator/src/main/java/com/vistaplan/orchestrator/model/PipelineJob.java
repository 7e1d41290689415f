package com.vistaplan.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One attempted unit of work bound to (run, step, service).
 *
 * Per-space work inside a step uses a service name like "render:space_kitchen_1",
 * so sub-units get their own row and their own lock.
 *
 * At most one row per (run, step, service) may be RUNNING; the partial unique
 * index uq_pipeline_jobs_running enforces this in the database.
 *
 * DB table: pipeline_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_jobs")
public class PipelineJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(nullable = false)
    private int step;

    @Column(name = "service_name", nullable = false)
    private String serviceName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    private int attempts = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts;

    @Column(name = "idempotency_key", unique = true)
    private String idempotencyKey;

    @Column(name = "lock_holder")
    private String lockHolder;

    @Column(name = "lock_expires_at")
    private Instant lockExpiresAt;

    // Earliest time a PENDING retry may be dispatched again.
    @Column(name = "not_before")
    private Instant notBefore;

    // JSON array of input artifact ids. Never raw bytes.
    @Column(name = "payload_ref", columnDefinition = "TEXT")
    private String payloadRef;

    // Id of the accepted artifact once COMPLETED, or of the best attempt once BLOCKED.
    @Column(name = "result_ref")
    private String resultRef;

    // Corrective instructions for the next attempt, composed from the last verdict.
    @Column(name = "corrective_instructions", columnDefinition = "TEXT")
    private String correctiveInstructions;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "last_error_trace", columnDefinition = "TEXT")
    private String lastErrorTrace;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    @Version
    private long version;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PipelineJob() {}   // required by JPA

    public PipelineJob(UUID runId, int step, String serviceName,
                       String idempotencyKey, int maxAttempts) {
        this.runId          = runId;
        this.step           = step;
        this.serviceName    = serviceName;
        this.idempotencyKey = idempotencyKey;
        this.maxAttempts    = maxAttempts;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()                     { return id; }
    public UUID      getRunId()                  { return runId; }
    public int       getStep()                   { return step; }
    public String    getServiceName()            { return serviceName; }
    public JobStatus getStatus()                 { return status; }
    public int       getAttempts()               { return attempts; }
    public int       getMaxAttempts()            { return maxAttempts; }
    public String    getIdempotencyKey()         { return idempotencyKey; }
    public String    getLockHolder()             { return lockHolder; }
    public Instant   getLockExpiresAt()          { return lockExpiresAt; }
    public Instant   getNotBefore()              { return notBefore; }
    public String    getPayloadRef()             { return payloadRef; }
    public String    getResultRef()              { return resultRef; }
    public String    getCorrectiveInstructions() { return correctiveInstructions; }
    public String    getLastError()              { return lastError; }
    public String    getLastErrorTrace()         { return lastErrorTrace; }
    public Instant   getCreatedAt()              { return createdAt; }
    public Instant   getStartedAt()              { return startedAt; }
    public Instant   getCompletedAt()            { return completedAt; }
    public Long      getProcessingTimeMs()       { return processingTimeMs; }

    public void setStatus(JobStatus status)           { this.status = status; }
    public void setLockHolder(String holder)          { this.lockHolder = holder; }
    public void setLockExpiresAt(Instant t)           { this.lockExpiresAt = t; }
    public void setNotBefore(Instant t)               { this.notBefore = t; }
    public void setPayloadRef(String v)               { this.payloadRef = v; }
    public void setResultRef(String v)                { this.resultRef = v; }
    public void setCorrectiveInstructions(String v)   { this.correctiveInstructions = v; }
    public void setLastError(String v)                { this.lastError = v; }
    public void setLastErrorTrace(String v)           { this.lastErrorTrace = v; }
    public void setStartedAt(Instant t)               { this.startedAt = t; }
    public void setCompletedAt(Instant t)             { this.completedAt = t; }
    public void setProcessingTimeMs(Long v)           { this.processingTimeMs = v; }
    public void incrementAttempts()                   { this.attempts++; }

    public boolean hasLiveLock(Instant now) {
        return status == JobStatus.RUNNING && lockExpiresAt != null && lockExpiresAt.isAfter(now);
    }

    public boolean attemptsExhausted() {
        return attempts >= maxAttempts;
    }

    public void clearLock() {
        this.lockHolder    = null;
        this.lockExpiresAt = null;
    }
}
