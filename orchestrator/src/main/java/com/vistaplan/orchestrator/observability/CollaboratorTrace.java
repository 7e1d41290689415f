package com.vistaplan.orchestrator.observability;

import java.time.Instant;
import java.util.UUID;

/**
 * One call to an external collaborator, with the metadata offline analysis needs
 * to group calls by run, step, attempt and prompt.
 *
 * @param promptId stable identity of the prompt template used (name@version)
 * @param status   "success", "error" or "timeout"
 */
public record CollaboratorTrace(
        String  collaborator,
        UUID    runId,
        int     step,
        Integer attempt,
        String  model,
        String  promptId,
        String  status,
        long    durationMs,
        String  error,
        Instant at
) {}
