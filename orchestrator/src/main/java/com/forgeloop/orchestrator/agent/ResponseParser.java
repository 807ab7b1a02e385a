package com.forgeloop.orchestrator.agent;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the structured answer from a Claude reply.
 *
 * Agents end their turn with {@code <result>{...json...}</result>}. Some
 * replies wrap the JSON in a ```json fence inside the tag; the fence is
 * stripped.
 */
public class ResponseParser {

    // Matches <result>...</result> (the agent's terminal output)
    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    // Matches ```json ... ``` or ``` ... ```
    private static final Pattern JSON_FENCE = Pattern.compile(
            "^```(?:json)?\\s*\\n(.*?)\\n?```$",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Extract the content of the first <result>...</result> tag.
     *
     * Returns Optional.empty() while the agent is still reasoning.
     */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        if (!m.find()) return Optional.empty();
        String body = m.group(1).strip();
        Matcher fence = JSON_FENCE.matcher(body);
        return Optional.of(fence.matches() ? fence.group(1).strip() : body);
    }
}
