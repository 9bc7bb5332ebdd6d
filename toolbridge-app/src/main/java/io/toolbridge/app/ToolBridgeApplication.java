package io.toolbridge.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.cli.CallCommand;
import io.toolbridge.cli.CliContext;
import io.toolbridge.cli.ListCommand;
import io.toolbridge.cli.SearchCommand;
import io.toolbridge.cli.StatusCommand;
import io.toolbridge.cli.ToolBridgeCommand;
import io.toolbridge.core.ToolAdapter;
import io.toolbridge.core.config.ConfigPaths;
import io.toolbridge.core.config.ConfigService;
import io.toolbridge.core.spi.ToolSourceRegistry;
import io.toolbridge.transport.ToolSources;
import java.nio.file.Path;
import java.time.Duration;
import okhttp3.OkHttpClient;
import picocli.CommandLine;

public final class ToolBridgeApplication {
    static final String CONFIG_ENV = "TOOLBRIDGE_CONFIG";

    private ToolBridgeApplication() {
    }

    public static void main(String[] args) {
        OkHttpClient httpClient = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .callTimeout(Duration.ofSeconds(60))
            .build();
        ToolSourceRegistry registry = ToolSources.defaults(httpClient, new ObjectMapper());

        CliContext context = new CliContext(
            new ConfigService(),
            configPath(System.getenv(CONFIG_ENV)),
            config -> ToolAdapter.create(config, registry)
        );
        int exitCode = commandLine(context).execute(args);
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
        System.exit(exitCode);
    }

    static CommandLine commandLine(CliContext context) {
        CommandLine commandLine = new CommandLine(new ToolBridgeCommand());
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("search", new SearchCommand(context));
        commandLine.addSubcommand("call", new CallCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        return commandLine;
    }

    static Path configPath(String override) {
        return override == null || override.isBlank() ? ConfigPaths.defaultConfigPath() : ConfigPaths.resolve(override);
    }
}
