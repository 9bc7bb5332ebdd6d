package io.toolbridge.transport.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.CliSource;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.Payloads;
import io.toolbridge.transport.manual.ManualParser;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Discovery runs the source command and reads its stdout as a manual. A call runs the tool's own
 * {@code command} from its call template, or the source command followed by the tool name, with every
 * argument appended as {@code --key value}.
 */
public final class CliToolSourceClient implements ToolSourceClient {
    private static final Logger LOG = LoggerFactory.getLogger(CliToolSourceClient.class);

    private final ObjectMapper mapper;
    private final ProcessRunner runner;
    private final ManualParser manualParser;

    public CliToolSourceClient(ObjectMapper mapper) {
        this(mapper, new ProcessRunner());
    }

    public CliToolSourceClient(ObjectMapper mapper, ProcessRunner runner) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.manualParser = new ManualParser(mapper);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.CLI;
    }

    @Override
    public List<RawTool> discover(SourceDescriptor source, ToolSession session) throws ToolSourceException {
        CliSource cli = (CliSource) source;
        ProcessResult result = run(cli, cli.command());
        if (!result.succeeded()) {
            throw ToolSourceException.remote("Manual command of source " + source.name() + " exited with "
                + result.exitCode() + " " + Payloads.snippet(result.stderr()));
        }
        return manualParser.parse(result.stdout(), source);
    }

    @Override
    public Object invoke(SourceDescriptor source, ToolSession session, RawTool tool, Map<String, Object> arguments)
        throws ToolSourceException {
        CliSource cli = (CliSource) source;
        Object templateCommand = tool.callTemplate().get("command");
        String base = templateCommand instanceof String own && !own.isBlank()
            ? own
            : cli.command() + " " + quote(tool.rawName());

        StringBuilder command = new StringBuilder(base);
        try {
            for (Map.Entry<String, Object> argument : arguments.entrySet()) {
                appendArgument(command, argument.getKey(), argument.getValue());
            }
        } catch (JsonProcessingException e) {
            throw ToolSourceException.malformed("Arguments for tool " + tool.rawName() + " cannot be encoded", e);
        }

        LOG.debug("Running tool {} of source {}", tool.rawName(), source.name());
        ProcessResult result = run(cli, command.toString());
        if (!result.succeeded()) {
            String detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
            throw ToolSourceException.remote("Tool " + tool.rawName() + " exited with " + result.exitCode() + " "
                + Payloads.snippet(detail));
        }
        return Payloads.decode(result.stdout(), mapper);
    }

    private ProcessResult run(CliSource source, String command) throws ToolSourceException {
        Path workingDir = source.workingDir() == null ? null : Path.of(source.workingDir());
        return runner.run(command, workingDir, source.env(), source.timeout());
    }

    private void appendArgument(StringBuilder command, String key, Object value) throws JsonProcessingException {
        if (value == null || Boolean.FALSE.equals(value)) {
            return;
        }
        if (Boolean.TRUE.equals(value)) {
            command.append(" --").append(key);
            return;
        }
        if (value instanceof Collection<?> values) {
            for (Object element : values) {
                appendArgument(command, key, element);
            }
            return;
        }
        String text = value instanceof Map<?, ?> ? mapper.writeValueAsString(value) : String.valueOf(value);
        command.append(" --").append(key).append(' ').append(quote(text));
    }

    static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
