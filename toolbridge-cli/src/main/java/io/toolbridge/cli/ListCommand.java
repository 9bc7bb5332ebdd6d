package io.toolbridge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.ToolAdapter;
import io.toolbridge.core.model.AdaptedTool;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", description = "List every tool in the catalog")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-c", "--config"}, description = "Config file override")
    Path config;

    @Option(names = {"-s", "--schema"}, description = "Print each tool's input schema")
    boolean schema;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (ToolAdapter adapter = context.startAdapter(config)) {
            ObjectMapper mapper = new ObjectMapper();
            for (AdaptedTool tool : adapter.listTools()) {
                System.out.println(ToolLines.describe(tool));
                if (schema) {
                    System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tool.inputSchema()));
                }
            }
            System.out.println(adapter.listTools().size() + " tool(s)");
            return 0;
        } catch (Exception e) {
            System.err.println("List command failed: " + e.getMessage());
            return 1;
        }
    }
}
