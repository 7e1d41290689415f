package com.vistaplan.orchestrator.learning;

import com.vistaplan.orchestrator.validation.ComparisonFailure;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity of a violation, independent of the run it happened in.
 *
 * "3:furniture_mismatch:bedroom # has no bed": step, failure type and the
 * normalized description (lowercased, digit runs collapsed to '#', punctuation
 * stripped). Two findings with the same key are treated as the same mistake.
 */
public final class RuleKeys {

    static final int MAX_DESCRIPTION = 80;
    static final int MAX_RULE_TEXT   = 300;

    private static final Pattern DIGITS    = Pattern.compile("\\d+");
    private static final Pattern NON_WORDS = Pattern.compile("[^a-z#]+");

    private RuleKeys() {}

    public static String keyFor(int step, ComparisonFailure failure) {
        return step + ":" + failure.type().wireName() + ":" + normalize(failure.description());
    }

    static String normalize(String description) {
        if (description == null) return "";
        String s = description.toLowerCase(Locale.ROOT);
        s = DIGITS.matcher(s).replaceAll("#");
        s = NON_WORDS.matcher(s).replaceAll(" ").trim();
        return s.length() > MAX_DESCRIPTION ? s.substring(0, MAX_DESCRIPTION).trim() : s;
    }

    /** Human-readable constraint handed to generation. */
    public static String ruleTextFor(ComparisonFailure failure) {
        String d = failure.description() == null ? failure.type().wireName() : failure.description().trim();
        String text = "Avoid: " + d;
        return text.length() > MAX_RULE_TEXT ? text.substring(0, MAX_RULE_TEXT) : text;
    }
}
