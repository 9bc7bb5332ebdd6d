package io.toolbridge.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Decoding of text payloads coming back from a source.
 */
public final class Payloads {

    private Payloads() {
    }

    /**
     * @return the JSON value of {@code raw} as plain maps, lists and scalars, or the trimmed text itself when it
     *         is not JSON
     */
    public static Object decode(String raw, ObjectMapper mapper) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String trimmed = raw.trim();
        char first = trimmed.charAt(0);
        if (first != '{' && first != '[' && first != '"') {
            return trimmed;
        }
        try {
            return mapper.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            return trimmed;
        }
    }

    public static String encode(Object value, ObjectMapper mapper) throws JsonProcessingException {
        if (value instanceof String text) {
            return text;
        }
        return mapper.writeValueAsString(value);
    }

    public static String snippet(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String trimmed = raw.trim();
        return trimmed.length() > 300 ? trimmed.substring(0, 300) + "..." : trimmed;
    }
}
