package io.toolbridge.core.schema;

import java.util.List;
import java.util.Map;

/**
 * @param schema   always an object schema, deeply unmodifiable
 * @param warnings one entry per construct that could not be converted faithfully; empty when lossless
 */
public record NormalizedSchema(Map<String, Object> schema, List<String> warnings) {
    public NormalizedSchema {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean degraded() {
        return !warnings.isEmpty();
    }
}
