package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum NextStep {
    PROCEED,
    RETRY,
    BLOCK_FOR_HUMAN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static NextStep parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
