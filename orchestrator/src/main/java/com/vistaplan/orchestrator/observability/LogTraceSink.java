package com.vistaplan.orchestrator.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one line per collaborator call to the "vistaplan.trace" logger.
 * Under the prod profile every key-value pair becomes a top-level JSON field.
 */
@Component
public class LogTraceSink implements TraceSink {

    private static final Logger trace = LoggerFactory.getLogger("vistaplan.trace");

    @Override
    public String name() { return "log"; }

    @Override
    public void accept(CollaboratorTrace t) {
        trace.atInfo()
                .setMessage("collaborator call {} step={} status={} durationMs={}")
                .addArgument(t.collaborator())
                .addArgument(t.step())
                .addArgument(t.status())
                .addArgument(t.durationMs())
                .addKeyValue("collaborator", t.collaborator())
                .addKeyValue("runId", t.runId())
                .addKeyValue("step", t.step())
                .addKeyValue("attempt", t.attempt())
                .addKeyValue("model", t.model())
                .addKeyValue("promptId", t.promptId())
                .addKeyValue("status", t.status())
                .addKeyValue("durationMs", t.durationMs())
                .log();
    }
}
