package com.vistaplan.orchestrator.repository;

import com.vistaplan.orchestrator.model.RuleOccurrence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;
import java.util.UUID;

public interface RuleOccurrenceRepository extends JpaRepository<RuleOccurrence, UUID> {

    Optional<RuleOccurrence> findByRuleKeyAndOwnerIdAndRunId(String ruleKey, String ownerId, UUID runId);

    @Query("SELECT COUNT(DISTINCT o.runId) FROM RuleOccurrence o WHERE o.ruleKey = :key AND o.ownerId = :ownerId")
    long countDistinctRuns(@Param("key") String ruleKey, @Param("ownerId") String ownerId);

    @Query("SELECT COUNT(DISTINCT o.runId) FROM RuleOccurrence o WHERE o.ruleKey = :key")
    long countDistinctRunsAllOwners(@Param("key") String ruleKey);
}
