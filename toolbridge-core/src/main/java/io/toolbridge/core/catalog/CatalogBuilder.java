package io.toolbridge.core.catalog;

import io.toolbridge.core.model.AdaptedTool;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.naming.NameSanitizer;
import io.toolbridge.core.schema.NormalizedSchema;
import io.toolbridge.core.schema.SchemaNormalizer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CatalogBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(CatalogBuilder.class);

    private final NameSanitizer sanitizer;
    private final SchemaNormalizer normalizer;

    public CatalogBuilder(NameSanitizer sanitizer, SchemaNormalizer normalizer) {
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
    }

    public CatalogBuildResult build(List<RawTool> rawTools) {
        Set<String> assigned = new HashSet<>();
        List<AdaptedTool> adapted = new ArrayList<>(rawTools.size());
        List<SchemaWarning> warnings = new ArrayList<>();

        for (RawTool raw : rawTools) {
            String name = sanitizer.sanitize(raw.rawName(), assigned);
            assigned.add(name);
            if (!name.equals(raw.rawName())) {
                LOG.debug("Tool {} from source {} exposed as {}", raw.rawName(), raw.source().name(), name);
            }

            NormalizedSchema schema = normalizer.normalize(raw.inputSchema());
            for (String message : schema.warnings()) {
                LOG.warn("Schema of tool {} from source {} degraded: {}", raw.rawName(), raw.source().name(), message);
                warnings.add(new SchemaWarning(raw.source().name(), raw.rawName(), message));
            }

            String description = raw.description().isBlank() ? "Tool: " + raw.rawName() : raw.description();
            adapted.add(new AdaptedTool(name, description, schema.schema(), raw));
        }
        return new CatalogBuildResult(new ToolCatalog(adapted), warnings);
    }
}
