package io.toolbridge.cli;

import io.toolbridge.core.ToolAdapter;
import io.toolbridge.core.config.AdapterConfig;
import io.toolbridge.core.config.ConfigService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Function;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Function<AdapterConfig, ToolAdapter> adapterFactory
) {
    /**
     * @param configOverride the {@code --config} value of the running command, or {@code null}
     * @return a started adapter; the caller closes it
     */
    ToolAdapter startAdapter(Path configOverride) throws IOException {
        AdapterConfig config = configService.load(resolveConfig(configOverride));
        return adapterFactory.apply(config).start();
    }

    Path resolveConfig(Path configOverride) {
        return configOverride != null ? configOverride : configPath;
    }
}
