package com.vistaplan.orchestrator.learning;

import java.util.UUID;

/**
 * A rule override that could not be applied. The rule is left unchanged.
 */
public class RuleOverrideException extends RuntimeException {

    public enum Kind { RULE_NOT_FOUND, CONFIDENCE_CAPPED, RULE_DISABLED }

    private final Kind kind;
    private final UUID ruleId;

    public RuleOverrideException(Kind kind, UUID ruleId, String message) {
        super("[" + kind + "] rule " + ruleId + ": " + message);
        this.kind   = kind;
        this.ruleId = ruleId;
    }

    public Kind getKind()   { return kind; }
    public UUID getRuleId() { return ruleId; }
}
