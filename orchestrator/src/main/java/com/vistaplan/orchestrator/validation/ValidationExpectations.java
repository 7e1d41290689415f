package com.vistaplan.orchestrator.validation;

import com.vistaplan.orchestrator.model.QualityTier;

import java.util.List;

/**
 * What the caller expects the artifact to contain. Every field is optional;
 * a null field disables the checks that depend on it.
 *
 * @param expectedCategories room categories the plan should contain, e.g. ["bedroom","kitchen"]
 */
public record ValidationExpectations(
        Integer           expectedSpaceCount,
        List<String>      expectedCategories,
        QualityTier       qualityTier,
        String            userRequest,
        String            styleConstraints
) {
    public ValidationExpectations {
        expectedCategories = expectedCategories == null ? List.of() : List.copyOf(expectedCategories);
    }

    public static ValidationExpectations none() {
        return new ValidationExpectations(null, List.of(), null, null, null);
    }

    /** The semantic stage only runs when there is user text to compare against. */
    public boolean hasUserText() {
        return (userRequest != null && !userRequest.isBlank())
            || (styleConstraints != null && !styleConstraints.isBlank());
    }
}
