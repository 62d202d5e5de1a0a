package com.proposalmind.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.regex.Pattern;

/**
 * Helpers for cleaning and parsing raw model output.
 */
public final class LlmResponses {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|markdown|md)?\\s*(.*?)```", Pattern.DOTALL);

    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .build();

    private LlmResponses() {}

    /**
     * Returns the body of the first fenced code block if the response contains one,
     * otherwise the trimmed response.
     */
    public static String stripCodeFences(String response) {
        if (response == null) {
            return "";
        }
        String trimmed = response.trim();
        if (!trimmed.contains("```")) {
            return trimmed;
        }
        var matcher = FENCED_BLOCK.matcher(trimmed);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        // Unterminated fence: drop the opening marker
        String withoutFence = trimmed.substring(trimmed.indexOf("```") + 3);
        if (withoutFence.startsWith("json")) {
            withoutFence = withoutFence.substring(4);
        }
        return withoutFence.trim();
    }

    /**
     * Parses a JSON object out of a model response, tolerating markdown fences
     * and prose before or after the object.
     *
     * @throws LlmParseException if no object of {@code type} can be read
     */
    public static <T> T readJson(String response, Class<T> type) {
        String cleaned = stripCodeFences(response);
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new LlmParseException("No JSON object found in response for " + type.getSimpleName(), null);
        }
        try {
            return LENIENT_MAPPER.readValue(cleaned.substring(start, end + 1), type);
        } catch (Exception e) {
            throw new LlmParseException("Failed to parse response to " + type.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }
}
