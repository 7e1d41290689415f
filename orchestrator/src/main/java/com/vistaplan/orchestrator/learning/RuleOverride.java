package com.vistaplan.orchestrator.learning;

/** Manual actions a user can take on a single learned rule. */
public enum RuleOverride {
    MUTE,
    UNMUTE,
    LOCK,
    UNLOCK,
    PROMOTE_TO_LAW
}
