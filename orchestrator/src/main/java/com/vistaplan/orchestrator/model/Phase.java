package com.vistaplan.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every state a pipeline run can be in.
 *
 * Each constant carries the step number it belongs to, so the
 * phase → step lookup is total by construction. The legal successor table
 * lives in {@code PhaseStateMachine}.
 *
 * Wire form is lower_snake_case ("top_down_3d_pending"). Unknown strings are
 * rejected when a request body is deserialized.
 */
public enum Phase {

    // Step 0: upload + space analysis
    UPLOAD(0),
    SPACE_ANALYSIS_PENDING(0),
    SPACE_ANALYSIS_RUNNING(0),
    SPACE_ANALYSIS_COMPLETE(0),

    // Step 1: top-down 3D render of the plan
    TOP_DOWN_3D_PENDING(1),
    TOP_DOWN_3D_RUNNING(1),
    TOP_DOWN_3D_REVIEW(1),

    // Step 2: style transfer
    STYLE_PENDING(2),
    STYLE_RUNNING(2),
    STYLE_REVIEW(2),

    // Step 3: space detection
    DETECT_SPACES_PENDING(3),
    DETECTING_SPACES(3),
    SPACES_DETECTED(3),

    // Step 4: camera intent
    CAMERA_INTENT_PENDING(4),
    CAMERA_INTENT_CONFIRMED(4),

    // Step 5: prompt templates
    PROMPT_TEMPLATES_PENDING(5),
    PROMPT_TEMPLATES_CONFIRMED(5),

    // Step 6: per-space renders
    OUTPUTS_PENDING(6),
    OUTPUTS_IN_PROGRESS(6),
    OUTPUTS_REVIEW(6),

    // Step 7: panoramas
    PANORAMAS_PENDING(7),
    PANORAMAS_IN_PROGRESS(7),
    PANORAMAS_REVIEW(7),

    // Step 8: merge into the 360° tour
    MERGING_PENDING(8),
    MERGING_IN_PROGRESS(8),
    MERGING_REVIEW(8),
    COMPLETED(8);

    private static final Map<String, Phase> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Phase::wireName, Function.identity()));

    private final int step;

    Phase(int step) {
        this.step = step;
    }

    public int step() { return step; }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Strict lookup; returns empty for anything outside the enumeration. */
    public static Optional<Phase> fromWireName(String value) {
        if (value == null) return Optional.empty();
        return Optional.ofNullable(BY_WIRE_NAME.get(value.trim().toLowerCase(Locale.ROOT)));
    }

    @JsonCreator
    static Phase parse(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown phase: " + value));
    }
}
