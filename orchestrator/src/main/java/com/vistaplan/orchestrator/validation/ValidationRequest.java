package com.vistaplan.orchestrator.validation;

public record ValidationRequest(
        ArtifactUnderReview    artifact,
        ValidationExpectations expectations,
        PolicyContext          policyContext
) {
    public ValidationRequest {
        if (expectations == null)  expectations = ValidationExpectations.none();
        if (policyContext == null) policyContext = PolicyContext.empty();
    }
}
