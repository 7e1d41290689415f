package com.vistaplan.orchestrator.judge;

/**
 * The semantic judge could not produce findings after its retries.
 *
 * This is a collaborator failure, not a validation outcome: the attempt is
 * recorded as FAILED on the job rather than turned into a verdict.
 */
public class JudgeException extends RuntimeException {

    public enum Kind { TIMEOUT, API_ERROR, MALFORMED_RESPONSE }

    private final Kind kind;

    public JudgeException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public JudgeException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
