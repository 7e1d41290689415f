package com.vistaplan.orchestrator.repository;

import com.vistaplan.orchestrator.model.Artifact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ArtifactRepository extends JpaRepository<Artifact, UUID> {

    List<Artifact> findByJobIdOrderByAttemptAsc(UUID jobId);

    List<Artifact> findByRunIdOrderByCreatedAtAsc(UUID runId);
}
