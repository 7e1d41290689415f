package com.vistaplan.orchestrator.model;

/** Kinds of entries in the shared promotion / audit log. */
public enum PromotionType {
    CREATED,
    ESCALATED,
    DEMOTED,
    SCOPE_PROMOTED,
    DISABLED,
    CONFIDENCE_CAPPED,
    USER_OVERRIDE,
    PROFILE_RESET,
    HUMAN_APPROVED,
    HUMAN_REJECTED
}
