package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * An MCP server reached either by spawning {@code command} (stdio transport) or over HTTP at {@code url}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record McpSource(
    String name,
    String command,
    List<String> args,
    String url,
    Map<String, String> env,
    Map<String, String> headers,
    @JsonAlias({"timeout_ms"}) Long timeoutMs
) implements SourceDescriptor {

    public McpSource {
        name = Descriptors.requireText(name, "name");
        command = Descriptors.textOr(command, null);
        url = Descriptors.textOr(url, null);
        if (command == null && url == null) {
            throw new IllegalArgumentException("mcp source '" + name + "' needs either command or url");
        }
        args = Descriptors.copy(args);
        env = Descriptors.copy(env);
        headers = Descriptors.copy(headers);
        timeoutMs = Descriptors.timeout(timeoutMs);
    }

    public static McpSource stdio(String name, String command, List<String> args) {
        return new McpSource(name, command, args, null, null, null, null);
    }

    public static McpSource http(String name, String url) {
        return new McpSource(name, null, null, url, null, null, null);
    }

    public boolean stdio() {
        return command != null;
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.MCP;
    }
}
