package io.toolbridge.core.model;

import io.toolbridge.core.source.SourceDescriptor;
import java.util.Map;
import java.util.Objects;

public record AdaptedTool(
    String adaptedName,
    String description,
    Map<String, Object> inputSchema,
    RawTool rawTool
) {
    public AdaptedTool {
        Objects.requireNonNull(adaptedName, "adaptedName must not be null");
        Objects.requireNonNull(inputSchema, "inputSchema must not be null");
        Objects.requireNonNull(rawTool, "rawTool must not be null");
        description = description == null ? "" : description;
    }

    public SourceDescriptor source() {
        return rawTool.source();
    }
}
