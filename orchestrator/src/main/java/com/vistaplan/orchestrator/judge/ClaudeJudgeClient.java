package com.vistaplan.orchestrator.judge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.claude.ClaudeClient;
import com.vistaplan.orchestrator.claude.ClaudeClient.ClaudeApiException;
import com.vistaplan.orchestrator.claude.ClaudeClient.Completion;
import com.vistaplan.orchestrator.claude.ClaudeClient.Message;
import com.vistaplan.orchestrator.config.JudgeProperties;
import com.vistaplan.orchestrator.observability.TraceRecorder;
import com.vistaplan.orchestrator.validation.ComparisonFailure;
import com.vistaplan.orchestrator.validation.FailureType;
import com.vistaplan.orchestrator.validation.FixTarget;
import com.vistaplan.orchestrator.validation.SemanticJudge;
import com.vistaplan.orchestrator.validation.Severity;
import com.vistaplan.orchestrator.validation.SuggestedFix;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Semantic judge backed by Claude.
 *
 * Transport errors are retried inside {@link ClaudeClient}; a reply that is
 * not parseable JSON is asked for once more here. Findings outside the fixed
 * taxonomy are dropped.
 */
@Component
public class ClaudeJudgeClient implements SemanticJudge {

    private static final Logger log = LoggerFactory.getLogger(ClaudeJudgeClient.class);

    private static final String COLLABORATOR = "judge";

    @JsonIgnoreProperties(ignoreUnknown = true)
    record JudgeReply(
            @JsonProperty("user_request_summary") String            userRequestSummary,
            @JsonProperty("failures")             List<RawFailure>  failures,
            @JsonProperty("suggested_fixes")      List<RawFix>      suggestedFixes
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RawFailure(String type, String description, String severity,
                      @JsonProperty("affected_space_id") String affectedSpaceId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RawFix(String target, String action,
                  @JsonProperty("expected_effect") String expectedEffect, Integer priority) {}

    private final ClaudeClient    claude;
    private final ObjectMapper    json;
    private final JudgeProperties props;
    private final TraceRecorder   traces;
    private final Retry           parseRetry;

    public ClaudeJudgeClient(ClaudeClient claude, ObjectMapper objectMapper,
                             JudgeProperties props, TraceRecorder traces) {
        this.claude = claude;
        this.json   = objectMapper;
        this.props  = props;
        this.traces = traces;
        this.parseRetry = Retry.of("judge-parse", RetryConfig.custom()
                .maxAttempts(2)
                .retryOnException(t -> t instanceof JudgeException j
                        && j.getKind() == JudgeException.Kind.MALFORMED_RESPONSE)
                .build());
    }

    @Override
    public Findings judge(Request request) {
        String userMessage = buildUserMessage(request);
        return Retry.decorateSupplier(parseRetry, () -> callOnce(request, userMessage)).get();
    }

    private Findings callOnce(Request request, String userMessage) {
        long started = System.nanoTime();
        String status = "success";
        String error = null;
        String model = props.judgeModel();
        try {
            Completion completion = claude.complete(props.judgeModel(), JudgePrompts.COMPARISON_SYSTEM,
                    List.of(new Message("user", userMessage)));
            model = completion.model();
            return toFindings(parse(completion.text()), model);
        } catch (ClaudeApiException e) {
            status = e.isTimeout() ? "timeout" : "error";
            error  = e.getMessage();
            throw new JudgeException(e.isTimeout() ? JudgeException.Kind.TIMEOUT : JudgeException.Kind.API_ERROR,
                    "Judge call failed for run " + request.runId() + " step " + request.step(), e);
        } catch (JudgeException e) {
            status = "error";
            error  = e.getMessage();
            throw e;
        } finally {
            traces.record(COLLABORATOR, request.runId(), request.step(), model, JudgePrompts.COMPARISON_ID,
                    status, (System.nanoTime() - started) / 1_000_000, error);
        }
    }

    // ------------------------------------------------------------------
    // Request / response mapping
    // ------------------------------------------------------------------

    private String buildUserMessage(Request request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("step", request.step());
        payload.put("user_request", request.userRequest());
        payload.put("style_constraints", request.styleConstraints());
        payload.put("expected_categories", request.expectedCategories());
        payload.put("detected_spaces", request.spaces());
        payload.put("learned_constraints", request.policyRules().stream()
                .map(r -> Map.of("rule", r.ruleText(), "strength", r.stage().name().toLowerCase(Locale.ROOT)))
                .toList());
        try {
            return json.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize judge request", e);
        }
    }

    private JudgeReply parse(String text) {
        Optional<String> body = JudgeResponseParser.extractJson(text);
        if (body.isEmpty()) {
            throw new JudgeException(JudgeException.Kind.MALFORMED_RESPONSE, "No JSON object in judge reply");
        }
        try {
            return json.readValue(body.get(), JudgeReply.class);
        } catch (JsonProcessingException e) {
            throw new JudgeException(JudgeException.Kind.MALFORMED_RESPONSE,
                    "Judge reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private Findings toFindings(JudgeReply reply, String model) {
        List<ComparisonFailure> failures = new ArrayList<>();
        if (reply.failures() != null) {
            for (RawFailure f : reply.failures()) {
                Optional<FailureType> type = FailureType.fromWireName(f.type());
                Optional<Severity> severity = parseSeverity(f.severity());
                if (type.isEmpty() || severity.isEmpty() || f.description() == null || f.description().isBlank()) {
                    log.warn("Dropping judge finding outside the taxonomy: type={} severity={}", f.type(), f.severity());
                    continue;
                }
                failures.add(new ComparisonFailure(type.get(), f.description().strip(), severity.get(),
                        f.affectedSpaceId(), null, null));
            }
        }
        List<SuggestedFix> fixes = new ArrayList<>();
        if (reply.suggestedFixes() != null) {
            for (RawFix x : reply.suggestedFixes()) {
                Optional<FixTarget> target = parseTarget(x.target());
                if (target.isEmpty() || x.action() == null || x.action().isBlank()) {
                    log.warn("Dropping judge fix with target={}", x.target());
                    continue;
                }
                int priority = x.priority() == null ? 5 : x.priority();
                fixes.add(new SuggestedFix(target.get(), x.action().strip(),
                        x.expectedEffect() == null ? "" : x.expectedEffect().strip(), priority));
            }
        }
        return new Findings(failures, fixes, reply.userRequestSummary(), model);
    }

    private static Optional<Severity> parseSeverity(String s) {
        try {
            return s == null ? Optional.empty() : Optional.of(Severity.parse(s));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static Optional<FixTarget> parseTarget(String s) {
        try {
            return s == null ? Optional.empty() : Optional.of(FixTarget.parse(s));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
