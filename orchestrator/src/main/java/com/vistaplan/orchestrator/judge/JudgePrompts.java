package com.vistaplan.orchestrator.judge;

/**
 * Prompt templates for the semantic comparison judge.
 *
 * Bump {@link #COMPARISON_ID} whenever the text changes; traces are grouped by it.
 */
public final class JudgePrompts {

    public static final String COMPARISON_ID = "space-comparison@3";

    private JudgePrompts() {}

    public static final String COMPARISON_SYSTEM = """
            You are a quality judge for an architectural visualization pipeline.
            You receive the spaces detected on a floor plan and the user's request.
            Report every way the detected spaces fail to satisfy the request.

            Respond with ONE JSON object and nothing else:
            {
              "user_request_summary": "<one or two sentences, max 1000 chars>",
              "failures": [
                {
                  "type": "<one of: schema_invalid, constraint_violation, quality_mismatch,
                           missing_space, extra_space, furniture_mismatch, style_inconsistency,
                           geometry_error, ambiguity_unresolved, llm_contradiction, timeout, api_error>",
                  "description": "<max 500 chars>",
                  "severity": "<low | medium | high | critical>",
                  "affected_space_id": "<space_id or null>"
                }
              ],
              "suggested_fixes": [
                {
                  "target": "<prompt | input | constraint | manual_review>",
                  "action": "<max 500 chars>",
                  "expected_effect": "<max 300 chars>",
                  "priority": <1-10, 1 = most important>
                }
              ]
            }

            RULES:
              - Use only the types and severities listed above.
              - "critical" means the output cannot be used at all.
              - Do not repeat a finding twice with different wording.
              - If everything matches, return empty arrays.
            """;
}
