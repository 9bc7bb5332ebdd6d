package io.toolbridge.core.catalog;

import java.util.List;

public record CatalogBuildResult(ToolCatalog catalog, List<SchemaWarning> warnings) {
    public CatalogBuildResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
