package com.vistaplan.orchestrator.phase;

import com.vistaplan.orchestrator.model.Phase;

import java.time.Instant;
import java.util.UUID;

/** Published after a transition commits; listeners must not write the run's phase. */
public record RunPhaseChangedEvent(UUID runId, Phase from, Phase to, Instant at) {}
