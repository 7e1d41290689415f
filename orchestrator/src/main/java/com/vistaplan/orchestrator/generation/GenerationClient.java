package com.vistaplan.orchestrator.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vistaplan.orchestrator.config.JudgeProperties;
import com.vistaplan.orchestrator.observability.TraceRecorder;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * HTTP client for the image generation service.
 *
 * The service is slow and non-deterministic; nothing it returns is trusted
 * before the validation engine has looked at it. Transient failures are retried
 * with exponential back-off, then surface as {@link GenerationException}.
 */
@Component
public class GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(GenerationClient.class);

    private static final String COLLABORATOR = "generation";

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final String        baseUrl;
    private final Duration      timeout;
    private final Retry         retry;
    private final TraceRecorder traces;

    public GenerationClient(@Value("${vistaplan.generation.base-url}") String baseUrl,
                            ObjectMapper objectMapper,
                            JudgeProperties props,
                            TraceRecorder traces) {
        this.baseUrl = baseUrl;
        this.json    = objectMapper;
        this.timeout = props.generationTimeout();
        this.traces  = traces;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.retry   = Retry.of("generation", RetryConfig.custom()
                .maxAttempts(props.retryAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(props.retryWait(), 2.0))
                .retryOnException(t -> t instanceof GenerationException g && g.isTransient())
                .build());
        this.retry.getEventPublisher().onRetry(e -> log.warn("Generation call failed (attempt {}), retrying: {}",
                e.getNumberOfRetryAttempts(), e.getLastThrowable().getMessage()));
    }

    /**
     * Ask the generation service for one artifact.
     *
     * @throws GenerationException after retries, or immediately for non-transient errors
     */
    public GenerationResult generate(GenerationRequest request) {
        log.info("Requesting generation run={} step={} service={} attempt={}",
                request.runId(), request.step(), request.service(), request.attempt());
        String body = toJson(request);
        return Retry.decorateSupplier(retry, () -> postOnce(request, body)).get();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private GenerationResult postOnce(GenerationRequest request, String body) {
        long started = System.nanoTime();
        String status = "success";
        String error = null;
        String model = null;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/generate"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            int code = resp.statusCode();
            if (code < 200 || code >= 300) {
                throw new GenerationException("generate failed: HTTP " + code + " " + resp.body(),
                        code == 429 || code >= 500);
            }
            GenerationResult result = json.readValue(resp.body(), GenerationResult.class);
            if (result.storageRef() == null || result.storageRef().isBlank()) {
                throw new GenerationException("generate returned no storage_ref", false);
            }
            model = result.model();
            return result;
        } catch (GenerationException e) {
            status = "error";
            error  = e.getMessage();
            throw e;
        } catch (HttpTimeoutException e) {
            status = "timeout";
            error  = e.getMessage();
            throw new GenerationException("generate timed out after " + timeout, e, true);
        } catch (JsonProcessingException e) {
            status = "error";
            error  = e.getMessage();
            throw new GenerationException("Failed to parse generate response", e, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = "error";
            error  = "interrupted";
            throw new GenerationException("Interrupted while calling generation service", e, false);
        } catch (Exception e) {
            status = "error";
            error  = e.getMessage();
            throw new GenerationException("generate failed", e, true);
        } finally {
            traces.record(COLLABORATOR, request.runId(), request.step(), model,
                    request.service() + "@step" + request.step(), status,
                    (System.nanoTime() - started) / 1_000_000, error);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new GenerationException("JSON serialization failed", e, false);
        }
    }
}
