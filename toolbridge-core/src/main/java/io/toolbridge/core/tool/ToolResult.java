package io.toolbridge.core.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public record ToolResult(String toolUseId, Status status, String text) {
    public enum Status {
        SUCCESS,
        ERROR;

        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ToolResult {
        Objects.requireNonNull(toolUseId, "toolUseId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        text = text == null ? "" : text;
    }

    public static ToolResult success(String toolUseId, String text) {
        return new ToolResult(toolUseId, Status.SUCCESS, text);
    }

    public static ToolResult error(String toolUseId, String message) {
        return new ToolResult(toolUseId, Status.ERROR, "Error: " + message);
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    /**
     * @return {@code {"toolUseId": ..., "status": "success"|"error", "content": [{"text": ...}]}}
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("toolUseId", toolUseId);
        map.put("status", status.wireName());
        map.put("content", List.of(Map.of("text", text)));
        return map;
    }
}
