package com.vistaplan.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.vistaplan.orchestrator.service.SubmittedAttempt;
import com.vistaplan.orchestrator.validation.ComparisonVerdict;

/**
 * Request body for POST /jobs/{id}/verdict: the result of an attempt executed
 * by an external worker, which must still hold the job's lock.
 * Artifacts travel by reference only.
 */
public record SubmitVerdictRequest(
        String            holder,
        String            storageRef,
        Integer           width,
        Integer           height,
        String            sha256,
        JsonNode          analysis,
        ComparisonVerdict verdict
) {
    public SubmittedAttempt toAttempt() {
        String analysisJson = analysis == null || analysis.isNull() ? null : analysis.toString();
        return new SubmittedAttempt(holder, storageRef, width, height, sha256, analysisJson, verdict);
    }
}
