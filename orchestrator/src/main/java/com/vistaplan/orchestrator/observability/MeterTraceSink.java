package com.vistaplan.orchestrator.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Turns collaborator traces into Micrometer meters:
 * <pre>
 *   vistaplan.collaborator.calls{collaborator, status}
 *   vistaplan.collaborator.duration{collaborator, model}
 * </pre>
 */
@Component
public class MeterTraceSink implements TraceSink {

    private final MeterRegistry meterRegistry;

    public MeterTraceSink(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String name() { return "micrometer"; }

    @Override
    public void accept(CollaboratorTrace trace) {
        meterRegistry.counter("vistaplan.collaborator.calls",
                "collaborator", trace.collaborator(), "status", trace.status()).increment();
        meterRegistry.timer("vistaplan.collaborator.duration",
                        "collaborator", trace.collaborator(),
                        "model", trace.model() == null ? "none" : trace.model())
                .record(Duration.ofMillis(trace.durationMs()));
    }
}
