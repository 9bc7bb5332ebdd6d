package io.toolbridge.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.ToolAdapter;
import io.toolbridge.core.error.ToolAdapterException;
import io.toolbridge.core.tool.AdaptedToolHandle;
import io.toolbridge.core.tool.ToolResult;
import io.toolbridge.core.tool.ToolUse;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "call", description = "Call a tool by name")
public final class CallCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Tool name (adapted or raw)")
    String tool;

    @Option(names = {"-a", "--args"}, description = "Arguments as a JSON object")
    String arguments = "{}";

    @Option(names = {"-c", "--config"}, description = "Config file override")
    Path config;

    public CallCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Map<String, Object> input;
        try {
            input = new ObjectMapper().readValue(arguments, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            System.err.println("Call command failed: --args is not a JSON object: " + e.getMessage());
            return 2;
        }

        try (ToolAdapter adapter = context.startAdapter(config)) {
            AdaptedToolHandle handle = adapter.getTool(tool)
                .map(found -> new AdaptedToolHandle(found, adapter::callTool))
                .orElseThrow(() -> ToolAdapterException.toolNotFound(tool));
            ToolResult result = handle.run(new ToolUse(UUID.randomUUID().toString(), handle.name(), input));
            if (result.isError()) {
                System.err.println(result.text());
                return 1;
            }
            System.out.println(result.text());
            return 0;
        } catch (Exception e) {
            System.err.println("Call command failed: " + e.getMessage());
            return 1;
        }
    }
}
