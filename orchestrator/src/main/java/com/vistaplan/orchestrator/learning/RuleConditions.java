package com.vistaplan.orchestrator.learning;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Where a rule applies. Stored as JSON on the rule; an empty condition set
 * applies everywhere.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleConditions(
        @JsonProperty("space_categories") List<String> spaceCategories
) {
    public RuleConditions {
        spaceCategories = spaceCategories == null ? List.of() : List.copyOf(spaceCategories);
    }

    public static RuleConditions always() {
        return new RuleConditions(List.of());
    }

    public static RuleConditions forCategory(String category) {
        return category == null ? always() : new RuleConditions(List.of(category));
    }

    /** True when the rule should be evaluated against an artifact holding these categories. */
    public boolean matches(Collection<String> presentCategories) {
        if (spaceCategories.isEmpty()) return true;
        Set<String> present = Set.copyOf(presentCategories);
        return spaceCategories.stream().anyMatch(present::contains);
    }
}
