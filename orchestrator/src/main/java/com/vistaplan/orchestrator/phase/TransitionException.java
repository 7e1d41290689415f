package com.vistaplan.orchestrator.phase;

/**
 * Rejected phase transition. The run is never modified when this is thrown.
 */
public class TransitionException extends RuntimeException {

    public enum Kind { ILLEGAL_TRANSITION, STALE_PHASE, UNKNOWN_PHASE, RUN_NOT_FOUND }

    private final Kind kind;

    public TransitionException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
