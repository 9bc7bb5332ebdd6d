package io.toolbridge.core.config;

import io.toolbridge.core.source.SourceDescriptor;
import java.util.List;

/**
 * @param sources            call templates in configuration order
 * @param failOnSessionError when set, a source whose session cannot be opened fails {@code start()}
 */
public record AdapterConfig(List<SourceDescriptor> sources, boolean failOnSessionError) {
    public AdapterConfig {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static AdapterConfig empty() {
        return new AdapterConfig(List.of(), false);
    }

    public static AdapterConfig of(SourceDescriptor... sources) {
        return new AdapterConfig(List.of(sources), false);
    }
}
