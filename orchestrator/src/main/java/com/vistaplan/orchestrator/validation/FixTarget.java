package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** What a suggested fix changes: the prompt, the input, a constraint, or nothing automatic. */
public enum FixTarget {
    PROMPT,
    INPUT,
    CONSTRAINT,
    MANUAL_REVIEW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FixTarget parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
