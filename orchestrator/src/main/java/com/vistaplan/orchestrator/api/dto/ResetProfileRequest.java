package com.vistaplan.orchestrator.api.dto;

public record ResetProfileRequest(String actor) {}
