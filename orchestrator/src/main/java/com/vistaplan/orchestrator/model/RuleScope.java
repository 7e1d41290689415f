package com.vistaplan.orchestrator.model;

/** Reach of a learned rule: one run, every run of one owner, or every run. */
public enum RuleScope {
    RUN,
    ACTOR,
    GLOBAL
}
