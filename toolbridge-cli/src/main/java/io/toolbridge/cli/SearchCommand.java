package io.toolbridge.cli;

import io.toolbridge.core.ToolAdapter;
import io.toolbridge.core.model.AdaptedTool;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "search", description = "Search tools by name and description")
public final class SearchCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "0..1", description = "Text to look for; empty lists everything")
    String query = "";

    @Option(names = {"-n", "--max"}, description = "Maximum number of results")
    int maxResults = ToolAdapter.DEFAULT_SEARCH_LIMIT;

    @Option(names = {"-c", "--config"}, description = "Config file override")
    Path config;

    public SearchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (ToolAdapter adapter = context.startAdapter(config)) {
            List<AdaptedTool> matches = adapter.searchTools(query, maxResults);
            matches.forEach(tool -> System.out.println(ToolLines.describe(tool)));
            if (matches.isEmpty()) {
                System.out.println("No tools match '" + query + "'");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Search command failed: " + e.getMessage());
            return 1;
        }
    }
}
