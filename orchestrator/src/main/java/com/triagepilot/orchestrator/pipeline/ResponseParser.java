package com.triagepilot.orchestrator.pipeline;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured payloads out of free-text model responses:
 *   1. <result> tags       the stage's explicit final answer
 *   2. ```json fences      structured output some prompts fall back to
 */
public class ResponseParser {

    // Matches <result>...</result>
    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    // Matches ```json ... ``` or ``` ... ``` (with optional language label)
    private static final Pattern JSON_BLOCK = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Extract the content of the first <result>...</result> tag.
     *
     * Example model output:
     *   "Here is the report:
     *    <result>{"chief_complaint": "headache"}</result>"
     */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** Extract the first fenced block, typically ```json. */
    public static Optional<String> extractFencedBlock(String response) {
        if (response == null) return Optional.empty();
        Matcher m = JSON_BLOCK.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /**
     * Best-effort structured payload: the result tag, else a fenced block,
     * else the whole response stripped.
     */
    public static String structuredPayload(String response) {
        return extractResult(response)
                .or(() -> extractFencedBlock(response))
                .orElse(response == null ? "" : response.strip());
    }
}
