package com.vistaplan.orchestrator.repository;

import com.vistaplan.orchestrator.model.PromotionLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface PromotionLogRepository extends JpaRepository<PromotionLogEntry, UUID> {

    List<PromotionLogEntry> findByRuleIdOrderByCreatedAtAsc(UUID ruleId);

    List<PromotionLogEntry> findByOwnerIdOrderByCreatedAtDesc(String ownerId);

    List<PromotionLogEntry> findByRunIdOrderByCreatedAtAsc(UUID runId);
}
