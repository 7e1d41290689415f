package com.vistaplan.orchestrator.judge;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the JSON object out of the judge's reply.
 *
 * The prompt asks for bare JSON, but models sometimes wrap it in a ```json
 * fence or add a sentence before it. Order of preference: fenced block, then
 * the outermost {...} span.
 */
public final class JudgeResponseParser {

    // Matches ```json ... ``` or ``` ... ```
    private static final Pattern FENCED = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n?```",
            Pattern.DOTALL
    );

    private JudgeResponseParser() {}

    public static Optional<String> extractJson(String response) {
        if (response == null || response.isBlank()) return Optional.empty();

        Matcher m = FENCED.matcher(response);
        if (m.find()) {
            String body = m.group(1).strip();
            if (body.startsWith("{")) return Optional.of(body);
        }

        int start = response.indexOf('{');
        int end   = response.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return Optional.of(response.substring(start, end + 1));
        }
        return Optional.empty();
    }
}
