package com.vistaplan.orchestrator.repository;

import com.vistaplan.orchestrator.model.Phase;
import com.vistaplan.orchestrator.model.PipelineRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface PipelineRunRepository extends JpaRepository<PipelineRun, UUID> {

    /**
     * Compare-and-set on the run's phase: phase and step move together, and only
     * if nobody else moved the run since the caller read it.
     *
     * @return number of rows updated; 0 means the expected phase is stale
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE PipelineRun r
               SET r.phase = :target, r.currentStep = :targetStep, r.updatedAt = :now
             WHERE r.id = :id AND r.phase = :expected
            """)
    int compareAndSetPhase(@Param("id") UUID id,
                           @Param("expected") Phase expected,
                           @Param("target") Phase target,
                           @Param("targetStep") int targetStep,
                           @Param("now") Instant now);

    // Column-level writes: a whole-entity save could write a stale phase back.

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PipelineRun r SET r.paused = :paused, r.updatedAt = :now WHERE r.id = :id")
    int setPaused(@Param("id") UUID id, @Param("paused") boolean paused, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PipelineRun r SET r.lastError = :error, r.updatedAt = :now WHERE r.id = :id")
    int setLastError(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);

    /** Compare-and-set on the step-output document. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE PipelineRun r
               SET r.stepOutputs = :updated, r.updatedAt = :now
             WHERE r.id = :id AND r.stepOutputs = :expected
            """)
    int compareAndSetStepOutputs(@Param("id") UUID id,
                                 @Param("expected") String expected,
                                 @Param("updated") String updated,
                                 @Param("now") Instant now);

    List<PipelineRun> findByOwnerIdOrderByCreatedAtDesc(String ownerId);
}
