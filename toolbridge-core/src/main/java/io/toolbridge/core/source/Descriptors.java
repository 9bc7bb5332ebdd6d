package io.toolbridge.core.source;

import java.util.List;
import java.util.Locale;
import java.util.Map;

final class Descriptors {
    static final long DEFAULT_TIMEOUT_MS = 30_000L;

    private Descriptors() {
    }

    static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value.trim();
    }

    static String textOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    static String method(String value) {
        return textOr(value, "GET").toUpperCase(Locale.ROOT);
    }

    static Map<String, String> copy(Map<String, String> value) {
        return value == null ? Map.of() : Map.copyOf(value);
    }

    static List<String> copy(List<String> value) {
        return value == null ? List.of() : List.copyOf(value);
    }

    static long timeout(Long value) {
        if (value == null) {
            return DEFAULT_TIMEOUT_MS;
        }
        if (value <= 0) {
            throw new IllegalArgumentException("timeout_ms must be > 0");
        }
        return value;
    }

    static int port(Integer value) {
        if (value == null || value < 1 || value > 65_535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        return value;
    }
}
