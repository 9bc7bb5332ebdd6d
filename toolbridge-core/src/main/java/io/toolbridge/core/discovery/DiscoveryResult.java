package io.toolbridge.core.discovery;

import io.toolbridge.core.model.RawTool;
import java.util.List;

/**
 * Raw tools from every source that answered, in source order and manifest order within a source, plus one
 * failure entry per source that did not.
 */
public record DiscoveryResult(List<RawTool> tools, List<SourceFailure> failures) {
    public DiscoveryResult {
        tools = tools == null ? List.of() : List.copyOf(tools);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static DiscoveryResult empty() {
        return new DiscoveryResult(List.of(), List.of());
    }
}
