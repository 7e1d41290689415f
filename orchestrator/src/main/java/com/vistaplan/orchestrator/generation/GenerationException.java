package com.vistaplan.orchestrator.generation;

/**
 * Thrown when the generation service returns an error or is unreachable.
 *
 * {@code transientFailure} marks errors worth retrying (timeouts, 429, 5xx).
 */
public class GenerationException extends RuntimeException {

    private final boolean transientFailure;

    public GenerationException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public GenerationException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() { return transientFailure; }
}
