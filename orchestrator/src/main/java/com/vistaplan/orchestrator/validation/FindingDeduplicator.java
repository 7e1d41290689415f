package com.vistaplan.orchestrator.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Drops judge findings that repeat what the rule battery already reported.
 *
 * A failure is a repeat when an existing failure has the same type and its
 * description contains the first 30 characters of the new one (case-insensitive).
 * Fixes follow the same rule on target and action.
 */
public final class FindingDeduplicator {

    static final int PREFIX = 30;

    private FindingDeduplicator() {}

    public static List<ComparisonFailure> newFailures(List<ComparisonFailure> existing,
                                                      List<ComparisonFailure> candidates) {
        List<ComparisonFailure> accepted = new ArrayList<>();
        List<ComparisonFailure> seen = new ArrayList<>(existing);
        for (ComparisonFailure c : candidates) {
            String prefix = prefix(c.description());
            boolean duplicate = seen.stream().anyMatch(e ->
                    e.type() == c.type() && lower(e.description()).contains(prefix));
            if (!duplicate) {
                accepted.add(c);
                seen.add(c);
            }
        }
        return accepted;
    }

    public static List<SuggestedFix> newFixes(List<SuggestedFix> existing, List<SuggestedFix> candidates) {
        List<SuggestedFix> accepted = new ArrayList<>();
        List<SuggestedFix> seen = new ArrayList<>(existing);
        for (SuggestedFix c : candidates) {
            String prefix = prefix(c.action());
            boolean duplicate = seen.stream().anyMatch(e ->
                    e.target() == c.target() && lower(e.action()).contains(prefix));
            if (!duplicate) {
                accepted.add(c);
                seen.add(c);
            }
        }
        return accepted;
    }

    private static String prefix(String s) {
        String l = lower(s);
        return l.length() <= PREFIX ? l : l.substring(0, PREFIX);
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
