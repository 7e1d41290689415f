package com.vistaplan.orchestrator.repository;

import com.vistaplan.orchestrator.model.VerdictRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface VerdictRecordRepository extends JpaRepository<VerdictRecord, UUID> {

    List<VerdictRecord> findByJobIdOrderByAttemptAsc(UUID jobId);

    List<VerdictRecord> findByRunIdOrderByCreatedAtAsc(UUID runId);
}
