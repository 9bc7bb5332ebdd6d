package io.toolbridge.core.catalog;

import io.toolbridge.core.model.AdaptedTool;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, insertion-ordered view of one discovery pass. A rebuild produces a new instance.
 */
public final class ToolCatalog {
    private static final ToolCatalog EMPTY = new ToolCatalog(List.of());

    private final Map<String, AdaptedTool> tools;

    public ToolCatalog(List<AdaptedTool> tools) {
        Map<String, AdaptedTool> byName = new LinkedHashMap<>();
        for (AdaptedTool tool : tools) {
            if (byName.putIfAbsent(tool.adaptedName(), tool) != null) {
                throw new IllegalArgumentException("Duplicate adapted tool name: " + tool.adaptedName());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
    }

    public static ToolCatalog empty() {
        return EMPTY;
    }

    public List<AdaptedTool> list() {
        return List.copyOf(tools.values());
    }

    public Optional<AdaptedTool> get(String adaptedName) {
        return adaptedName == null ? Optional.empty() : Optional.ofNullable(tools.get(adaptedName));
    }

    /**
     * Looks up by adapted name first, then by raw name when exactly one tool carries it.
     */
    public Optional<AdaptedTool> resolve(String name) {
        Optional<AdaptedTool> direct = get(name);
        if (direct.isPresent() || name == null) {
            return direct;
        }
        List<AdaptedTool> byRawName = tools.values().stream()
            .filter(tool -> tool.rawTool().rawName().equals(name))
            .toList();
        return byRawName.size() == 1 ? Optional.of(byRawName.get(0)) : Optional.empty();
    }

    /**
     * Case-insensitive substring search over name and description. Exact name matches rank first, then name
     * matches, then description matches; ties keep catalog order. A blank query matches every tool.
     */
    public List<AdaptedTool> search(String query, int maxResults) {
        if (maxResults < 0) {
            throw new IllegalArgumentException("maxResults must be >= 0");
        }
        if (maxResults == 0) {
            return List.of();
        }
        String needle = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        List<Ranked> matches = new ArrayList<>();
        int position = 0;
        for (AdaptedTool tool : tools.values()) {
            int rank = rank(tool, needle);
            if (rank >= 0) {
                matches.add(new Ranked(tool, rank, position));
            }
            position++;
        }
        matches.sort(Comparator.comparingInt(Ranked::rank).thenComparingInt(Ranked::position));
        return matches.stream().limit(maxResults).map(Ranked::tool).toList();
    }

    public int size() {
        return tools.size();
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    private static int rank(AdaptedTool tool, String needle) {
        if (needle.isEmpty()) {
            return 3;
        }
        String name = tool.adaptedName().toLowerCase(Locale.ROOT);
        if (name.equals(needle)) {
            return 0;
        }
        if (name.contains(needle)) {
            return 1;
        }
        if (tool.description().toLowerCase(Locale.ROOT).contains(needle)) {
            return 2;
        }
        return -1;
    }

    private record Ranked(AdaptedTool tool, int rank, int position) {
    }
}
