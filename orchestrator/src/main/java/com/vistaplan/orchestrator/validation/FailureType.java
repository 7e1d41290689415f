package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** Fixed taxonomy shared by the rule battery and the semantic judge. */
public enum FailureType {
    SCHEMA_INVALID,
    CONSTRAINT_VIOLATION,
    QUALITY_MISMATCH,
    MISSING_SPACE,
    EXTRA_SPACE,
    FURNITURE_MISMATCH,
    STYLE_INCONSISTENCY,
    GEOMETRY_ERROR,
    AMBIGUITY_UNRESOLVED,
    LLM_CONTRADICTION,
    TIMEOUT,
    API_ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FailureType> fromWireName(String value) {
        if (value == null) return Optional.empty();
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @JsonCreator
    static FailureType parse(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown failure type: " + value));
    }
}
