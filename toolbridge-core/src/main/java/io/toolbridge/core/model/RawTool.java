package io.toolbridge.core.model;

import io.toolbridge.core.source.SourceDescriptor;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tool exactly as its source reported it. The schemas are kept untouched; {@code callTemplate} holds any
 * per-tool call template the manifest carried.
 */
public record RawTool(
    String rawName,
    String description,
    Object inputSchema,
    Object outputSchema,
    Map<String, Object> callTemplate,
    SourceDescriptor source
) {
    public RawTool {
        Objects.requireNonNull(rawName, "rawName must not be null");
        Objects.requireNonNull(source, "source must not be null");
        description = description == null ? "" : description;
        callTemplate = callTemplate == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(callTemplate));
    }

    public static RawTool of(String rawName, String description, Object inputSchema, SourceDescriptor source) {
        return new RawTool(rawName, description, inputSchema, null, null, source);
    }
}
