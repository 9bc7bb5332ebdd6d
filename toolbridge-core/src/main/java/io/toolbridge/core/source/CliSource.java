package io.toolbridge.core.source;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CliSource(
    String name,
    String command,
    @JsonAlias({"working_dir"}) String workingDir,
    Map<String, String> env,
    @JsonAlias({"timeout_ms"}) Long timeoutMs
) implements SourceDescriptor {

    public CliSource {
        name = Descriptors.requireText(name, "name");
        command = Descriptors.requireText(command, "command");
        workingDir = Descriptors.textOr(workingDir, null);
        env = Descriptors.copy(env);
        timeoutMs = Descriptors.timeout(timeoutMs);
    }

    public static CliSource of(String name, String command) {
        return new CliSource(name, command, null, null, null);
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.CLI;
    }
}
