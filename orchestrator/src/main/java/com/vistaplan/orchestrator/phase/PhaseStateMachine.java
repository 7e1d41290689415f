package com.vistaplan.orchestrator.phase;

import com.vistaplan.orchestrator.model.Phase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.vistaplan.orchestrator.model.Phase.*;

/**
 * The fixed transition table of a pipeline run.
 *
 * Every non-final phase has exactly one legal successor. Within a step the
 * run moves pending → running → review/complete; the terminal phase of a
 * step hands over to the pending phase of the next step. Steps 4 and 5 are
 * confirmations and have no running phase.
 *
 * The table is checked when the class loads: a successor never lowers the
 * step number and never skips a step.
 */
public final class PhaseStateMachine {

    private static final Map<Phase, Phase> SUCCESSORS;

    static {
        Map<Phase, Phase> m = new EnumMap<>(Phase.class);
        // step 0
        m.put(UPLOAD,                     SPACE_ANALYSIS_PENDING);
        m.put(SPACE_ANALYSIS_PENDING,     SPACE_ANALYSIS_RUNNING);
        m.put(SPACE_ANALYSIS_RUNNING,     SPACE_ANALYSIS_COMPLETE);
        m.put(SPACE_ANALYSIS_COMPLETE,    TOP_DOWN_3D_PENDING);
        // step 1
        m.put(TOP_DOWN_3D_PENDING,        TOP_DOWN_3D_RUNNING);
        m.put(TOP_DOWN_3D_RUNNING,        TOP_DOWN_3D_REVIEW);
        m.put(TOP_DOWN_3D_REVIEW,         STYLE_PENDING);
        // step 2
        m.put(STYLE_PENDING,              STYLE_RUNNING);
        m.put(STYLE_RUNNING,              STYLE_REVIEW);
        m.put(STYLE_REVIEW,               DETECT_SPACES_PENDING);
        // step 3
        m.put(DETECT_SPACES_PENDING,      DETECTING_SPACES);
        m.put(DETECTING_SPACES,           SPACES_DETECTED);
        m.put(SPACES_DETECTED,            CAMERA_INTENT_PENDING);
        // step 4
        m.put(CAMERA_INTENT_PENDING,      CAMERA_INTENT_CONFIRMED);
        m.put(CAMERA_INTENT_CONFIRMED,    PROMPT_TEMPLATES_PENDING);
        // step 5
        m.put(PROMPT_TEMPLATES_PENDING,   PROMPT_TEMPLATES_CONFIRMED);
        m.put(PROMPT_TEMPLATES_CONFIRMED, OUTPUTS_PENDING);
        // step 6
        m.put(OUTPUTS_PENDING,            OUTPUTS_IN_PROGRESS);
        m.put(OUTPUTS_IN_PROGRESS,        OUTPUTS_REVIEW);
        m.put(OUTPUTS_REVIEW,             PANORAMAS_PENDING);
        // step 7
        m.put(PANORAMAS_PENDING,          PANORAMAS_IN_PROGRESS);
        m.put(PANORAMAS_IN_PROGRESS,      PANORAMAS_REVIEW);
        m.put(PANORAMAS_REVIEW,           MERGING_PENDING);
        // step 8
        m.put(MERGING_PENDING,            MERGING_IN_PROGRESS);
        m.put(MERGING_IN_PROGRESS,        MERGING_REVIEW);
        m.put(MERGING_REVIEW,             COMPLETED);

        m.forEach(PhaseStateMachine::checkStepDelta);
        SUCCESSORS = Collections.unmodifiableMap(m);
    }

    private PhaseStateMachine() {}

    /** The unique legal successor, or empty for a final phase. */
    public static Optional<Phase> next(Phase current) {
        return Optional.ofNullable(SUCCESSORS.get(current));
    }

    public static boolean isLegal(Phase from, Phase to) {
        return to != null && to == SUCCESSORS.get(from);
    }

    public static boolean isFinal(Phase phase) {
        return !SUCCESSORS.containsKey(phase);
    }

    /** Read-only view of the whole table, for the phases endpoint and tests. */
    public static Map<Phase, Phase> table() {
        return SUCCESSORS;
    }

    /**
     * The in-progress phase a step enters once work on it starts, if the step
     * has one (confirmation steps 4 and 5 do not).
     */
    public static Optional<Phase> workingPhaseOf(Phase pending) {
        if (!pending.name().endsWith("_PENDING")) return Optional.empty();
        return next(pending).filter(p -> p.step() == pending.step() && next(p)
                .map(after -> after.step() == pending.step())
                .orElse(false));
    }

    /**
     * Parse a phase name from outside the service.
     *
     * @throws TransitionException with kind UNKNOWN_PHASE for anything not in the enumeration
     */
    public static Phase parse(String value) {
        return Phase.fromWireName(value).orElseThrow(() -> new TransitionException(
                TransitionException.Kind.UNKNOWN_PHASE, "Unknown phase: " + value));
    }

    static void checkStepDelta(Phase from, Phase to) {
        int delta = to.step() - from.step();
        if (delta < 0 || delta > 1) {
            throw new IllegalStateException(
                    "Transition %s -> %s changes step by %d".formatted(from, to, delta));
        }
    }
}
