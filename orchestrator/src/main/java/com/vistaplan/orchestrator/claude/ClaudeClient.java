package com.vistaplan.orchestrator.claude;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.config.JudgeProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API, used as the semantic judge's transport.
 *
 * Transient failures (429, 5xx, I/O, timeouts) are retried with exponential
 * back-off; anything else fails on the first attempt.
 */
@Component
public class ClaudeClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role must be "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content, String model) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        public String firstText() {
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new ClaudeApiException(200, "No text block in response"));
        }
    }

    /** Assistant text plus the model that actually answered. */
    public record Completion(String text, String model) {}

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_URL    = "https://api.anthropic.com/v1/messages";
    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 4096;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final Duration     timeout;
    private final Retry        retry;

    public ClaudeClient(@Value("${anthropic.api-key}") String apiKey,
                        ObjectMapper objectMapper,
                        JudgeProperties props) {
        this.apiKey  = apiKey;
        this.json    = objectMapper;
        this.timeout = props.judgeTimeout();
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.retry   = Retry.of("claude", RetryConfig.custom()
                .maxAttempts(props.retryAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(props.retryWait(), 2.0))
                .retryOnException(ClaudeClient::isTransient)
                .build());
        this.retry.getEventPublisher().onRetry(e -> log.warn("Claude call failed (attempt {}), retrying: {}",
                e.getNumberOfRetryAttempts(), e.getLastThrowable().getMessage()));
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send one conversation and return the assistant's reply.
     *
     * @param system   system prompt, may be null
     * @throws ClaudeApiException once retries are exhausted or on a non-retryable error
     */
    public Completion complete(String model, String system, List<Message> messages) {
        return Retry.decorateSupplier(retry, () -> send(model, system, messages)).get();
    }

    private Completion send(String model, String system, List<Message> messages) {
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("model",      model);
            body.put("max_tokens", MAX_TOKENS);
            if (system != null) body.put("system", system);
            body.put("messages",   messages);

            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(API_URL))
                    .timeout(timeout)
                    .header("content-type",      "application/json")
                    .header("x-api-key",         apiKey)
                    .header("anthropic-version", API_VER)
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new ClaudeApiException(response.statusCode(), response.body());
            }

            MessagesResponse parsed = json.readValue(response.body(), MessagesResponse.class);
            return new Completion(parsed.firstText(), parsed.model() == null ? model : parsed.model());

        } catch (ClaudeApiException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new ClaudeApiException("Claude API call timed out after " + timeout, e, true);
        } catch (IOException e) {
            throw new ClaudeApiException("Claude API call failed: " + e.getMessage(), e, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClaudeApiException("Interrupted while calling Claude API", e, false);
        }
    }

    static boolean isTransient(Throwable t) {
        if (!(t instanceof ClaudeApiException e)) return false;
        if (e.statusCode() == 0) return !(e.getCause() instanceof InterruptedException);
        return e.statusCode() == 429 || e.statusCode() == 529 || e.statusCode() >= 500;
    }

    // -------------------------------------------------------------------------
    // Exception type
    // -------------------------------------------------------------------------

    public static class ClaudeApiException extends RuntimeException {
        private final int     statusCode;
        private final boolean timeout;

        public ClaudeApiException(int statusCode, String body) {
            super("Claude API error %d: %s".formatted(statusCode, body));
            this.statusCode = statusCode;
            this.timeout    = false;
        }

        /** Transport failure; statusCode is 0. */
        public ClaudeApiException(String message, Throwable cause, boolean timeout) {
            super(message, cause);
            this.statusCode = 0;
            this.timeout    = timeout;
        }

        public int statusCode()   { return statusCode; }
        public boolean isTimeout() { return timeout; }
    }
}
