package com.repofactor.orchestrator.agent;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Claude's text responses.
 *
 * Every agent prompt asks for the final answer as JSON inside
 * {@code <result>...</result>}. Models sometimes wrap that JSON in a
 * markdown fence as well, so the fence is stripped when present.
 */
public class ResponseParser {

    // Matches <result>...</result> (the agent's final answer)
    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    // Matches ```json ... ``` or ``` ... ``` wrapping the whole payload
    private static final Pattern FENCED = Pattern.compile(
            "^```[a-zA-Z]*\\s*\\n(.*?)\\n?```$",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /**
     * Extract the content of the first {@code <result>} tag.
     * Empty if the response has no tag or the tag is empty.
     */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        if (!m.find()) return Optional.empty();
        String content = m.group(1).strip();
        return content.isEmpty() ? Optional.empty() : Optional.of(content);
    }

    /**
     * Extract the JSON payload of a response: the {@code <result>} content with
     * any surrounding markdown fence removed.
     */
    public static Optional<String> extractJson(String response) {
        return extractResult(response).map(ResponseParser::stripFence);
    }

    static String stripFence(String text) {
        Matcher m = FENCED.matcher(text.strip());
        return m.matches() ? m.group(1).strip() : text.strip();
    }
}
