package com.vistaplan.orchestrator.model;

public enum ArtifactKind {
    IMAGE,
    PANORAMA,
    TOUR,
    ANALYSIS_JSON,
    VERDICT_JSON
}
