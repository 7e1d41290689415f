package com.vistaplan.orchestrator.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Decides, for one produced artifact, whether to proceed, retry or stop for a human.
 *
 * <ol>
 *   <li><b>Schema</b>: the analysis document must satisfy
 *       {@link AnalysisSchemaValidator}. Each violation is one critical failure
 *       and the later stages are skipped.</li>
 *   <li><b>Rules</b>: {@link DeterministicRuleBattery}, no network.</li>
 *   <li><b>Semantic</b>: only with user text and an analysis document;
 *       findings already reported by stage 2 are dropped.</li>
 * </ol>
 * Validation failures are returned as verdicts. Only a judge that keeps
 * failing surfaces as an exception.
 *
 * <pre>
 *   vistaplan.verdicts{next_step="proceed|retry|block_for_human"}
 * </pre>
 */
@Service
public class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    public static final String RULES_ONLY = "rules-only";

    private final AnalysisSchemaValidator  schemaValidator  = new AnalysisSchemaValidator();
    private final DeterministicRuleBattery ruleBattery      = new DeterministicRuleBattery();

    private final VerdictSchemaValidator verdictValidator;
    private final SemanticJudge judge;
    private final ObjectMapper  json;
    private final MeterRegistry meterRegistry;

    public ValidationEngine(SemanticJudge judge, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        this.judge         = judge;
        this.json          = objectMapper;
        this.meterRegistry = meterRegistry;
        this.verdictValidator = new VerdictSchemaValidator(objectMapper);
    }

    public ComparisonVerdict validate(ValidationRequest request) {
        long started = System.nanoTime();
        ArtifactUnderReview artifact = request.artifact();
        ValidationExpectations expectations = request.expectations();

        // ── Stage 1: structure ───────────────────────────────────────────────
        List<String> schemaErrors = new ArrayList<>();
        SpaceAnalysis analysis = parseAnalysis(artifact, schemaErrors);
        if (!schemaErrors.isEmpty()) {
            log.warn("Artifact {} failed schema validation: {}", artifact.artifactId(), schemaErrors);
            List<ComparisonFailure> failures = schemaErrors.stream()
                    .map(e -> ComparisonFailure.of(FailureType.SCHEMA_INVALID, Severity.CRITICAL,
                            "Analysis document is structurally invalid: " + e))
                    .toList();
            SuggestedFix fix = new SuggestedFix(FixTarget.MANUAL_REVIEW,
                    "Inspect the generation output; it does not match the analysis schema",
                    "A reviewer decides whether to regenerate or fix the input", 1);
            return finish(artifact, failures, List.of(fix),
                    summaryFor(expectations), RULES_ONLY, started);
        }

        // ── Stage 2: deterministic rules ─────────────────────────────────────
        StageFindings findings = ruleBattery.run(analysis, artifact, expectations);
        String summary = summaryFor(expectations);
        String modelUsed = RULES_ONLY;

        // ── Stage 3: semantic comparison ─────────────────────────────────────
        // The judge compares detected spaces, so image-only artifacts stop at stage 2.
        if (expectations.hasUserText() && analysis != null) {
            SemanticJudge.Findings judged = judge.judge(new SemanticJudge.Request(
                    artifact.runId(), artifact.step(), analysis.spaces(),
                    expectations.userRequest(), expectations.styleConstraints(),
                    expectations.expectedCategories(), request.policyContext().rules()));
            List<ComparisonFailure> fresh = FindingDeduplicator.newFailures(findings.failures(), judged.failures());
            List<SuggestedFix> freshFixes = FindingDeduplicator.newFixes(findings.fixes(), judged.fixes());
            log.debug("Judge returned {} failure(s), {} new after dedup", judged.failures().size(), fresh.size());
            findings.addAll(fresh, freshFixes);
            if (judged.userRequestSummary() != null && !judged.userRequestSummary().isBlank()) {
                summary = judged.userRequestSummary();
            }
            modelUsed = judged.modelUsed();
        }

        return finish(artifact, findings.failures(), findings.fixes(), summary, modelUsed, started);
    }

    /**
     * Re-derive a verdict produced outside this engine. Its failures and fixes
     * are kept; pass and next step are recomputed by the same decision policy
     * and the result is schema-checked like any other verdict.
     */
    public ComparisonVerdict normalize(ComparisonVerdict submitted, UUID artifactId) {
        ArtifactUnderReview subject = new ArtifactUnderReview(submitted.runId(), submitted.stepId(),
                artifactId, null, null, null);
        return finish(subject, submitted.failures(), submitted.suggestedFixes(),
                submitted.userRequestSummary(),
                submitted.modelUsed() == null ? "external" : submitted.modelUsed(),
                System.nanoTime() - submitted.processingTimeMs() * 1_000_000);
    }

    private ComparisonVerdict finish(ArtifactUnderReview artifact, List<ComparisonFailure> failures,
                                     List<SuggestedFix> fixes, String summary, String modelUsed, long started) {
        VerdictPolicy.Decision decision = VerdictPolicy.decide(failures);
        List<SuggestedFix> sorted = fixes.stream()
                .sorted(Comparator.comparingInt(SuggestedFix::priority))
                .toList();
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        ComparisonVerdict verdict = verdictValidator.sanitize(new ComparisonVerdict(
                artifact.runId(), artifact.step(), decision.pass(), summary, failures, sorted,
                decision.nextStep(), elapsedMs, modelUsed));

        List<String> errors = verdictValidator.validate(verdict);
        if (!errors.isEmpty()) {
            log.error("Verdict for artifact {} failed self-validation, blocking: {}", artifact.artifactId(), errors);
            verdict = VerdictSchemaValidator.fallback(verdict, errors);
        }

        meterRegistry.counter("vistaplan.verdicts", "next_step", verdict.recommendedNextStep().wireName()).increment();
        log.info("Verdict for run={} step={} artifact={}: pass={} next={} failures={} ({})",
                artifact.runId(), artifact.step(), artifact.artifactId(), verdict.pass(),
                verdict.recommendedNextStep().wireName(), verdict.failures().size(), decision.reason());
        return verdict;
    }

    /**
     * Parse and schema-check the analysis document. Returns null when the
     * artifact has none; an artifact with neither analysis nor image size is
     * itself a schema violation.
     */
    private SpaceAnalysis parseAnalysis(ArtifactUnderReview artifact, List<String> errors) {
        String raw = artifact.analysisJson();
        if (raw == null || raw.isBlank()) {
            boolean hasSize = artifact.width() != null && artifact.height() != null
                    && artifact.width() > 0 && artifact.height() > 0;
            if (!hasSize) {
                errors.add("artifact carries neither an analysis document nor image dimensions");
            }
            return null;
        }
        JsonNode tree;
        try {
            tree = json.readTree(raw);
        } catch (JsonProcessingException e) {
            errors.add("not valid JSON: " + e.getOriginalMessage());
            return null;
        }
        errors.addAll(schemaValidator.validate(tree));
        if (!errors.isEmpty()) return null;
        try {
            return json.treeToValue(tree, SpaceAnalysis.class);
        } catch (JsonProcessingException e) {
            errors.add("could not bind analysis document: " + e.getOriginalMessage());
            return null;
        }
    }

    private static String summaryFor(ValidationExpectations expectations) {
        if (expectations.userRequest() != null && !expectations.userRequest().isBlank()) {
            return expectations.userRequest().strip();
        }
        if (expectations.styleConstraints() != null && !expectations.styleConstraints().isBlank()) {
            return "Style constraints: " + expectations.styleConstraints().strip();
        }
        return "No user request supplied; validated against structural and business rules only.";
    }
}
