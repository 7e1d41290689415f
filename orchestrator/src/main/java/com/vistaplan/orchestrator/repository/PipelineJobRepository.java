package com.vistaplan.orchestrator.repository;

import com.vistaplan.orchestrator.model.JobStatus;
import com.vistaplan.orchestrator.model.PipelineJob;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PipelineJobRepository extends JpaRepository<PipelineJob, UUID> {

    Optional<PipelineJob> findByIdempotencyKey(String idempotencyKey);

    /**
     * Lock the newest live row for (run, step, service) so acquire and reclaim
     * decisions are made against a row nobody else is deciding on.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT j FROM PipelineJob j
            WHERE j.runId = :runId AND j.step = :step AND j.serviceName = :service
              AND j.status IN ('PENDING', 'RUNNING')
            ORDER BY j.createdAt DESC
            LIMIT 1
            """)
    Optional<PipelineJob> lockOpenJob(@Param("runId") UUID runId,
                                      @Param("step") int step,
                                      @Param("service") String service);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM PipelineJob j WHERE j.id = :id")
    Optional<PipelineJob> lockById(@Param("id") UUID id);

    /**
     * Oldest PENDING job whose back-off has elapsed and whose run is not paused.
     * Rows already locked by another dispatcher are skipped (lock timeout -2 is
     * Hibernate's SKIP LOCKED).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT j FROM PipelineJob j
            WHERE j.status = 'PENDING'
              AND (j.notBefore IS NULL OR j.notBefore <= :now)
              AND j.runId IN (SELECT r.id FROM PipelineRun r WHERE r.paused = false)
            ORDER BY j.createdAt ASC
            LIMIT 1
            """)
    Optional<PipelineJob> claimNextDispatchable(@Param("now") Instant now);

    /** Attempts spent across every job of a run; the retry budget is per run too. */
    @Query("SELECT COALESCE(SUM(j.attempts), 0) FROM PipelineJob j WHERE j.runId = :runId")
    long sumAttemptsForRun(@Param("runId") UUID runId);

    List<PipelineJob> findByStatusAndLockExpiresAtBefore(JobStatus status, Instant cutoff);

    List<PipelineJob> findByRunIdOrderByCreatedAtAsc(UUID runId);

    List<PipelineJob> findByRunIdAndStepOrderByCreatedAtAsc(UUID runId, int step);
}
