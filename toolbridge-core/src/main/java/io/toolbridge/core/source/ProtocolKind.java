package io.toolbridge.core.source;

import java.util.Locale;
import java.util.Optional;

public enum ProtocolKind {
    HTTP("http"),
    SSE("sse"),
    STREAMABLE_HTTP("streamable_http"),
    CLI("cli"),
    GRAPHQL("graphql"),
    MCP("mcp"),
    TCP("tcp"),
    UDP("udp"),
    TEXT("text");

    private final String wireName;

    ProtocolKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return the {@code call_template_type} value used in configuration files
     */
    public String wireName() {
        return wireName;
    }

    public static Optional<ProtocolKind> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ProtocolKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
