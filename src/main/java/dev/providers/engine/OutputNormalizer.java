package dev.providers.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction of a JSON value from free-form tool or model output.
 * Finding nothing is not an error: callers fall back to the raw text.
 */
public final class OutputNormalizer {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    // First '{' through last '}'; a heuristic, not a parser.
    private static final Pattern OBJECT_SPAN = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private OutputNormalizer() {}

    /**
     * Parse {@code text} as JSON, or failing that the first {@code {...}} span inside it.
     *
     * @return the parsed value, or null when no structured output is found
     */
    public static JsonNode parse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }

        // Step 1: the whole output
        JsonNode node = tryParse(text.trim());
        if (node != null) {
            return node;
        }

        // Step 2: an embedded object
        Matcher matcher = OBJECT_SPAN.matcher(text);
        if (matcher.find()) {
            return tryParse(matcher.group());
        }
        return null;
    }

    private static JsonNode tryParse(String candidate) {
        try {
            JsonNode node = MAPPER.readTree(candidate);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
