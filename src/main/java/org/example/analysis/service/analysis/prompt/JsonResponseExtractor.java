package org.example.analysis.service.analysis.prompt;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

/**
 * Finds the first syntactically valid JSON object or array in model output. Models
 * often wrap the answer in prose or markdown fences.
 */
public final class JsonResponseExtractor {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonResponseExtractor() {}

    public static Optional<JsonNode> extract(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        String text = stripCodeFences(response.trim());

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '{' && c != '[') {
                continue;
            }
            JsonNode node = tryParseAt(text, i);
            if (node != null && (node.isObject() || node.isArray())) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    static String stripCodeFences(String text) {
        String result = text;
        if (result.startsWith("```json")) {
            result = result.substring("```json".length()).trim();
        } else if (result.startsWith("```")) {
            result = result.substring(3).trim();
        }
        if (result.endsWith("```")) {
            result = result.substring(0, result.length() - 3).trim();
        }
        return result;
    }

    private static JsonNode tryParseAt(String text, int start) {
        try (JsonParser parser = objectMapper.getFactory().createParser(text.substring(start))) {
            return objectMapper.readTree(parser);
        } catch (IOException e) {
            return null;
        }
    }

    public static String textOrDefault(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? fallback : text.trim();
    }

    public static double doubleOrDefault(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            return fallback;
        }
        return value.asDouble();
    }
}
