package com.vistaplan.orchestrator.repository;

import com.vistaplan.orchestrator.model.PolicyRule;
import com.vistaplan.orchestrator.model.RuleScope;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PolicyRuleRepository extends JpaRepository<PolicyRule, UUID> {

    /**
     * Every enabled rule that can apply to a job of this run at this step:
     * the run's own rules, the owner's rules and global rules.
     */
    @Query("""
            SELECT r FROM PolicyRule r
            WHERE r.step = :step AND r.disabled = false
              AND (   (r.scope = 'RUN'    AND r.runId   = :runId)
                   OR (r.scope = 'ACTOR'  AND r.ownerId = :ownerId)
                   OR  r.scope = 'GLOBAL')
            ORDER BY r.createdAt ASC
            """)
    List<PolicyRule> findApplicable(@Param("runId") UUID runId,
                                    @Param("ownerId") String ownerId,
                                    @Param("step") int step);

    Optional<PolicyRule> findByScopeAndRunIdAndRuleKey(RuleScope scope, UUID runId, String ruleKey);

    Optional<PolicyRule> findByScopeAndOwnerIdAndRuleKey(RuleScope scope, String ownerId, String ruleKey);

    Optional<PolicyRule> findByScopeAndRuleKey(RuleScope scope, String ruleKey);

    List<PolicyRule> findByScopeAndRuleKeyAndDisabledFalse(RuleScope scope, String ruleKey);

    List<PolicyRule> findByScopeAndOwnerId(RuleScope scope, String ownerId);

    List<PolicyRule> findByOwnerIdOrderByCreatedAtAsc(String ownerId);

    List<PolicyRule> findByDisabledFalse();
}
