package com.vistaplan.orchestrator.validation;

import com.vistaplan.orchestrator.model.QualityTier;
import com.vistaplan.orchestrator.validation.SpaceAnalysis.DetectedSpace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.vistaplan.orchestrator.validation.FailureType.*;
import static com.vistaplan.orchestrator.validation.Severity.*;

/**
 * Fixed battery of numeric and structural checks over a space analysis.
 *
 * No I/O. Each failing check appends exactly one failure, plus the fix a
 * retry should try first.
 */
public class DeterministicRuleBattery {

    static final int    MIN_SPACES                = 2;
    static final int    MAX_SPACES                = 20;
    static final int    COUNT_TOLERANCE           = 2;
    static final double LOW_CONFIDENCE            = 0.3;
    static final double MAX_LOW_CONFIDENCE_RATIO  = 0.5;
    static final double MAX_AMBIGUOUS_RATIO       = 0.3;

    /** Missing one of these from the expected list escalates to high. */
    static final Set<String> CRITICAL_CATEGORIES = Set.of("bedroom", "bathroom", "kitchen");

    /** Checked on any plan that looks residential; kitchen is optional (studios, annexes). */
    static final Set<String> RESIDENTIAL_REQUIRED = Set.of("bedroom", "bathroom");

    static final Set<String> HABITABLE = Set.of("bedroom", "living_room", "dining_room", "kitchen", "office");

    /**
     * @param analysis may be null for artifacts without an analysis document;
     *                 only the resolution check runs then
     */
    public StageFindings run(SpaceAnalysis analysis, ArtifactUnderReview artifact,
                             ValidationExpectations expectations) {
        StageFindings out = new StageFindings();

        if (analysis != null) {
            List<DetectedSpace> spaces = analysis.spaces();
            checkMinimumSpaces(spaces, out);
            checkMaximumSpaces(spaces, out);
            checkExpectedCount(spaces, expectations, out);
            checkExpectedCategories(spaces, expectations, out);
            checkResidentialCategories(spaces, expectations, out);
            checkLowConfidenceRatio(spaces, out);
            checkUnflaggedLowConfidence(spaces, out);
            checkAmbiguityRatio(spaces, out);
            checkDuplicateLabels(spaces, out);
            checkHabitableFurnishings(spaces, out);
        }
        checkResolution(artifact, expectations, out);
        return out;
    }

    // ------------------------------------------------------------------
    // Counts
    // ------------------------------------------------------------------

    void checkMinimumSpaces(List<DetectedSpace> spaces, StageFindings out) {
        if (spaces.size() >= MIN_SPACES) return;
        out.fail(ComparisonFailure.of(MISSING_SPACE, HIGH,
                        "Only %d space(s) detected; a floor plan must resolve to at least %d distinct spaces"
                                .formatted(spaces.size(), MIN_SPACES),
                        ">= " + MIN_SPACES, String.valueOf(spaces.size())),
                new SuggestedFix(FixTarget.INPUT,
                        "Upload a higher-resolution floor plan with readable room boundaries",
                        "Space detection can separate individual rooms", 1));
    }

    void checkMaximumSpaces(List<DetectedSpace> spaces, StageFindings out) {
        if (spaces.size() <= MAX_SPACES) return;
        out.fail(ComparisonFailure.of(EXTRA_SPACE, HIGH,
                        "%d spaces detected; more than %d usually means rooms were fragmented"
                                .formatted(spaces.size(), MAX_SPACES),
                        "<= " + MAX_SPACES, String.valueOf(spaces.size())),
                new SuggestedFix(FixTarget.PROMPT,
                        "Merge fragments of the same room and ignore furniture outlines when detecting spaces",
                        "Space count drops to the number of real rooms", 2));
    }

    void checkExpectedCount(List<DetectedSpace> spaces, ValidationExpectations exp, StageFindings out) {
        Integer expected = exp.expectedSpaceCount();
        if (expected == null || expected == spaces.size()) return;
        int diff = spaces.size() - expected;
        FailureType type = diff > 0 ? EXTRA_SPACE : MISSING_SPACE;
        Severity severity = Math.abs(diff) > COUNT_TOLERANCE ? HIGH : MEDIUM;
        out.fail(ComparisonFailure.of(type, severity,
                        "Detected %d spaces but %d were expected".formatted(spaces.size(), expected),
                        String.valueOf(expected), String.valueOf(spaces.size())),
                new SuggestedFix(FixTarget.PROMPT,
                        diff > 0
                                ? "Detect exactly %d spaces; do not split open-plan areas".formatted(expected)
                                : "Detect exactly %d spaces; include small rooms such as storage and WC".formatted(expected),
                        "Detected space count matches the expected layout", 2));
    }

    void checkExpectedCategories(List<DetectedSpace> spaces, ValidationExpectations exp, StageFindings out) {
        if (exp.expectedCategories().isEmpty()) return;
        Set<String> present = categories(spaces);
        List<String> missing = exp.expectedCategories().stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .filter(c -> !present.contains(c))
                .distinct()
                .toList();
        if (missing.isEmpty()) return;
        boolean critical = missing.stream().anyMatch(CRITICAL_CATEGORIES::contains);
        out.fail(ComparisonFailure.of(MISSING_SPACE, critical ? HIGH : MEDIUM,
                        "Expected room types not detected: " + String.join(", ", missing),
                        String.join(", ", exp.expectedCategories()), String.join(", ", present)),
                new SuggestedFix(FixTarget.PROMPT,
                        "Look specifically for: " + String.join(", ", missing),
                        "All expected room types are identified", 2));
    }

    /**
     * Runs alongside the expected-category check. Rooms the expected list
     * already reported as missing are not reported twice.
     */
    void checkResidentialCategories(List<DetectedSpace> spaces, ValidationExpectations exp, StageFindings out) {
        Set<String> present = categories(spaces);
        boolean residential = present.contains("bedroom") || present.contains("living_room");
        if (!residential) return;
        Set<String> expected = exp.expectedCategories().stream()
                .map(c -> c.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<String> missing = RESIDENTIAL_REQUIRED.stream()
                .filter(c -> !present.contains(c) && !expected.contains(c))
                .sorted()
                .toList();
        if (missing.isEmpty()) return;
        ComparisonFailure failure = ComparisonFailure.of(MISSING_SPACE, MEDIUM,
                "Residential plan without " + String.join(" or ", missing),
                String.join(", ", RESIDENTIAL_REQUIRED.stream().sorted().toList()),
                String.join(", ", present));
        SuggestedFix fix = new SuggestedFix(FixTarget.PROMPT,
                "Check whether a " + String.join("/", missing) + " was labelled as another category",
                "Core residential rooms are identified", 3);
        if (FindingDeduplicator.newFailures(out.failures(), List.of(failure)).isEmpty()) return;
        out.fail(failure, FindingDeduplicator.newFixes(out.fixes(), List.of(fix)).stream().findFirst().orElse(null));
    }

    // ------------------------------------------------------------------
    // Confidence and ambiguity
    // ------------------------------------------------------------------

    void checkLowConfidenceRatio(List<DetectedSpace> spaces, StageFindings out) {
        if (spaces.isEmpty()) return;
        long low = spaces.stream().filter(s -> s.confidence() < LOW_CONFIDENCE).count();
        double ratio = (double) low / spaces.size();
        if (ratio <= MAX_LOW_CONFIDENCE_RATIO) return;
        out.fail(ComparisonFailure.of(AMBIGUITY_UNRESOLVED, HIGH,
                        "%d of %d spaces have confidence below %.1f".formatted(low, spaces.size(), LOW_CONFIDENCE),
                        "<= 50%", Math.round(ratio * 100) + "%"),
                new SuggestedFix(FixTarget.INPUT,
                        "Provide a cleaner scan of the floor plan; most rooms could not be identified reliably",
                        "Majority of spaces are detected with usable confidence", 1));
    }

    void checkUnflaggedLowConfidence(List<DetectedSpace> spaces, StageFindings out) {
        List<String> unflagged = spaces.stream()
                .filter(s -> s.confidence() < LOW_CONFIDENCE && s.ambiguityFlags().isEmpty())
                .map(DetectedSpace::spaceId)
                .toList();
        if (unflagged.isEmpty()) return;
        out.fail(ComparisonFailure.of(AMBIGUITY_UNRESOLVED, MEDIUM,
                                "Low-confidence spaces without an ambiguity flag: " + String.join(", ", unflagged),
                                "ambiguity flag on every space below " + LOW_CONFIDENCE,
                                String.valueOf(unflagged.size()))
                        .forSpace(unflagged.get(0)),
                new SuggestedFix(FixTarget.PROMPT,
                        "Add an ambiguity flag explaining every space detected with confidence below 0.3",
                        "Uncertain detections are explained instead of silently guessed", 3));
    }

    void checkAmbiguityRatio(List<DetectedSpace> spaces, StageFindings out) {
        if (spaces.isEmpty()) return;
        long flagged = spaces.stream().filter(s -> !s.ambiguityFlags().isEmpty()).count();
        double ratio = (double) flagged / spaces.size();
        if (ratio <= MAX_AMBIGUOUS_RATIO) return;
        out.fail(ComparisonFailure.of(AMBIGUITY_UNRESOLVED, MEDIUM,
                        "%d of %d spaces carry ambiguity flags".formatted(flagged, spaces.size()),
                        "<= 30%", Math.round(ratio * 100) + "%"),
                new SuggestedFix(FixTarget.MANUAL_REVIEW,
                        "Have a reviewer confirm the flagged spaces before rendering",
                        "Ambiguous rooms are resolved by a human", 2));
    }

    // ------------------------------------------------------------------
    // Consistency
    // ------------------------------------------------------------------

    void checkDuplicateLabels(List<DetectedSpace> spaces, StageFindings out) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (DetectedSpace s : spaces) {
            counts.merge(s.label().trim().toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        List<String> duplicates = counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .toList();
        if (duplicates.isEmpty()) return;
        out.fail(ComparisonFailure.of(CONSTRAINT_VIOLATION, LOW,
                        "Duplicate space labels: " + String.join(", ", duplicates)),
                new SuggestedFix(FixTarget.PROMPT,
                        "Give every space a unique label, e.g. 'Bedroom 1', 'Bedroom 2'",
                        "Each space can be addressed unambiguously", 5));
    }

    void checkHabitableFurnishings(List<DetectedSpace> spaces, StageFindings out) {
        List<String> bare = spaces.stream()
                .filter(s -> HABITABLE.contains(s.category()) && s.detectedFurnishings().isEmpty())
                .map(DetectedSpace::spaceId)
                .toList();
        if (bare.isEmpty()) return;
        out.fail(ComparisonFailure.of(FURNITURE_MISMATCH, LOW,
                                "Habitable spaces with no detected furnishings: " + String.join(", ", bare))
                        .forSpace(bare.get(0)),
                new SuggestedFix(FixTarget.PROMPT,
                        "List the furniture drawn in each habitable room",
                        "Renders can place furniture where the plan shows it", 4));
    }

    void checkResolution(ArtifactUnderReview artifact, ValidationExpectations exp, StageFindings out) {
        QualityTier requested = exp.qualityTier();
        if (requested == null || artifact.width() == null || artifact.height() == null) return;
        QualityTier tier = QualityTier.effectiveFor(artifact.step(), requested);
        if (tier.accepts(artifact.width(), artifact.height())) return;
        out.fail(ComparisonFailure.of(QUALITY_MISMATCH, MEDIUM,
                        "Image is %dx%d, outside the %s window".formatted(artifact.width(), artifact.height(), tier.label()),
                        "%d-%d px long edge".formatted(tier.minLongEdge(), tier.maxLongEdge()),
                        "%dx%d".formatted(artifact.width(), artifact.height())),
                new SuggestedFix(FixTarget.PROMPT,
                        "Render at " + tier.label() + " output size",
                        "Output resolution matches the requested tier", 3));
    }

    private static Set<String> categories(List<DetectedSpace> spaces) {
        return spaces.stream()
                .map(DetectedSpace::category)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /** Space ids in detection order, for step outputs. */
    public static List<String> spaceIds(SpaceAnalysis analysis) {
        return new ArrayList<>(analysis.spaces().stream().map(DetectedSpace::spaceId).toList());
    }
}
