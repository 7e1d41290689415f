package com.vistaplan.orchestrator.api.dto;

/**
 * Request body for POST /runs/{id}/transition.
 *
 * expectedPhase is the phase the caller last saw; targetPhase is optional and,
 * when given, must be the legal successor of expectedPhase.
 */
public record TransitionRequest(String expectedPhase, String targetPhase) {}
