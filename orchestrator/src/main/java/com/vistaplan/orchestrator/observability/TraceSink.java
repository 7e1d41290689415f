package com.vistaplan.orchestrator.observability;

/**
 * Destination for collaborator traces. Implementations may throw; the
 * recorder contains the failure.
 */
public interface TraceSink {

    String name();

    void accept(CollaboratorTrace trace);
}
