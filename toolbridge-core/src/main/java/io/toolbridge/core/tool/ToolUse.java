package io.toolbridge.core.tool;

import java.util.Map;
import java.util.Objects;

public record ToolUse(String toolUseId, String name, Map<String, Object> input) {
    public ToolUse {
        Objects.requireNonNull(toolUseId, "toolUseId must not be null");
        input = input == null ? Map.of() : input;
    }
}
