package com.vistaplan.orchestrator.ledger;

import com.vistaplan.orchestrator.model.PipelineJob;

/** @param created false when an existing job was returned instead of a new one */
public record JobRequestResult(PipelineJob job, boolean created) {}
