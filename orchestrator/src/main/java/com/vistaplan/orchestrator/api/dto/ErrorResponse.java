package com.vistaplan.orchestrator.api.dto;

/** Body of every error response. kind is a stable machine-readable code. */
public record ErrorResponse(String error, String kind, String message) {}
