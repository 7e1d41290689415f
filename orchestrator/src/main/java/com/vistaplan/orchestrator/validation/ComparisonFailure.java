package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One typed finding. {@code expected}/{@code actual} carry the evidence when
 * the check has something concrete to show.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComparisonFailure(
        FailureType type,
        String      description,
        Severity    severity,
        String      affectedSpaceId,
        String      expected,
        String      actual
) {
    public static ComparisonFailure of(FailureType type, Severity severity, String description) {
        return new ComparisonFailure(type, description, severity, null, null, null);
    }

    public static ComparisonFailure of(FailureType type, Severity severity, String description,
                                       String expected, String actual) {
        return new ComparisonFailure(type, description, severity, null, expected, actual);
    }

    public ComparisonFailure forSpace(String spaceId) {
        return new ComparisonFailure(type, description, severity, spaceId, expected, actual);
    }
}
