package com.vistaplan.orchestrator.service;

import com.vistaplan.orchestrator.model.QualityTier;

public record StartRunCommand(
        String      ownerId,
        QualityTier qualityTier,
        String      userRequest,
        String      styleConstraints
) {}
