package com.vistaplan.orchestrator.validation;

/** @param priority 1 (do first) to 10 */
public record SuggestedFix(
        FixTarget target,
        String    action,
        String    expectedEffect,
        int       priority
) {}
