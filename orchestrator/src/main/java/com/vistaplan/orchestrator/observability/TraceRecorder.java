package com.vistaplan.orchestrator.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Fans collaborator traces out to every registered {@link TraceSink}.
 *
 * A sink that throws is logged and skipped; tracing never fails a pipeline call.
 */
@Component
public class TraceRecorder {

    private static final Logger log = LoggerFactory.getLogger(TraceRecorder.class);

    private final List<TraceSink> sinks;
    private final Clock           clock;

    public TraceRecorder(List<TraceSink> sinks, Clock clock) {
        this.sinks = List.copyOf(sinks);
        this.clock = clock;
    }

    public void record(String collaborator, UUID runId, int step, String model, String promptId,
                       String status, long durationMs, String error) {
        CollaboratorTrace t = new CollaboratorTrace(collaborator, runId, step, currentAttempt(),
                model, promptId, status, durationMs, error, clock.instant());
        for (TraceSink sink : sinks) {
            try {
                sink.accept(t);
            } catch (RuntimeException e) {
                log.warn("Trace sink '{}' failed for {} call on run {}: {}",
                        sink.name(), collaborator, runId, e.getMessage());
            }
        }
    }

    // AttemptRunner puts the attempt index in the MDC for the duration of an attempt.
    private static Integer currentAttempt() {
        String a = MDC.get("attempt");
        if (a == null) return null;
        try {
            return Integer.valueOf(a);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric attempt in MDC: {}", a);
            return null;
        }
    }
}
