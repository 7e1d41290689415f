package com.vistaplan.orchestrator.service;

import com.vistaplan.orchestrator.validation.ComparisonVerdict;

/**
 * An attempt executed and judged outside this service, reported back by the
 * worker that holds the job's lock.
 */
public record SubmittedAttempt(
        String            holder,
        String            storageRef,
        Integer           width,
        Integer           height,
        String            sha256,
        String            analysisJson,
        ComparisonVerdict verdict
) {}
