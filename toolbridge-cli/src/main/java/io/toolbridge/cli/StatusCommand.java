package io.toolbridge.cli;

import io.toolbridge.core.ToolAdapter;
import io.toolbridge.core.catalog.SchemaWarning;
import io.toolbridge.core.discovery.SourceFailure;
import io.toolbridge.core.source.SourceDescriptor;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "status", description = "Show configured sources and the outcome of discovery")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"-c", "--config"}, description = "Config file override")
    Path config;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        Path configPath = context.resolveConfig(config);
        System.out.println("Config path: " + configPath);
        System.out.println("Config exists: " + Files.exists(configPath));
        try (ToolAdapter adapter = context.startAdapter(config)) {
            System.out.println("Sources: " + adapter.sources().size());
            for (SourceDescriptor source : adapter.sources()) {
                System.out.println("  " + source.name() + " (" + source.kind().wireName() + ")");
            }
            System.out.println("Live sessions: " + adapter.liveSessions());
            System.out.println("Tools: " + adapter.listTools().size());
            System.out.println("Unreachable sources: " + adapter.discoveryFailures().size());
            for (SourceFailure failure : adapter.discoveryFailures()) {
                System.out.println("  " + failure.sourceName() + ": " + failure.message());
            }
            System.out.println("Schema warnings: " + adapter.schemaWarnings().size());
            for (SchemaWarning warning : adapter.schemaWarnings()) {
                System.out.println("  " + warning.sourceName() + "/" + warning.rawName() + ": " + warning.message());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
