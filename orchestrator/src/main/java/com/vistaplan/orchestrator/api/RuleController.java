package com.vistaplan.orchestrator.api;

import com.vistaplan.orchestrator.api.dto.OverrideRequest;
import com.vistaplan.orchestrator.api.dto.PromotionLogResponse;
import com.vistaplan.orchestrator.api.dto.ResetProfileRequest;
import com.vistaplan.orchestrator.api.dto.RuleResponse;
import com.vistaplan.orchestrator.service.PipelineService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for learned rules.
 *
 * POST /rules/{id}/overrides          record-override (mute, lock, promote to law, ...)
 * GET  /rules/{id}/promotion-log      the rule's history
 * GET  /owners/{ownerId}/rules        every rule scoped to an owner
 * GET  /owners/{ownerId}/promotion-log
 * POST /owners/{ownerId}/reset        fresh start: disable the owner's learned rules
 */
@RestController
public class RuleController {

    private final PipelineService pipeline;

    public RuleController(PipelineService pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping("/rules/{id}/overrides")
    public RuleResponse override(@PathVariable UUID id, @RequestBody OverrideRequest req) {
        if (req.override() == null) {
            throw new IllegalArgumentException("override is required");
        }
        return RuleResponse.from(pipeline.recordOverride(id, req.override(), req.actor(), req.reason()));
    }

    @GetMapping("/rules/{id}/promotion-log")
    public List<PromotionLogResponse> ruleHistory(@PathVariable UUID id) {
        return pipeline.promotionLogForRule(id).stream().map(PromotionLogResponse::from).toList();
    }

    @GetMapping("/owners/{ownerId}/rules")
    public List<RuleResponse> ownerRules(@PathVariable String ownerId) {
        return pipeline.rulesForOwner(ownerId).stream().map(RuleResponse::from).toList();
    }

    @GetMapping("/owners/{ownerId}/promotion-log")
    public List<PromotionLogResponse> ownerHistory(@PathVariable String ownerId) {
        return pipeline.promotionLogForOwner(ownerId).stream().map(PromotionLogResponse::from).toList();
    }

    @PostMapping("/owners/{ownerId}/reset")
    public Map<String, Object> reset(@PathVariable String ownerId, @RequestBody ResetProfileRequest req) {
        int disabled = pipeline.resetProfile(ownerId, req.actor());
        return Map.of("ownerId", ownerId, "rulesDisabled", disabled);
    }
}
