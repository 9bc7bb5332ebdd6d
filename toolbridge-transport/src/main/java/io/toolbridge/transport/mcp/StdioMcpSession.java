package io.toolbridge.transport.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.toolbridge.core.source.McpSource;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.TransportErrors;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP over a spawned process: newline-delimited JSON-RPC on stdin/stdout. A reader thread queues every
 * response; stderr goes to the debug log.
 */
final class StdioMcpSession implements McpSession {
    private static final Logger LOG = LoggerFactory.getLogger(StdioMcpSession.class);
    private static final JsonNode END_OF_STREAM = MissingNode.getInstance();

    private final McpSource source;
    private final ObjectMapper mapper;
    private final JsonRpc jsonRpc;
    private final Process process;
    private final BufferedWriter stdin;
    private final BlockingQueue<JsonNode> responses = new LinkedBlockingQueue<>();
    private final AtomicLong ids = new AtomicLong();

    private StdioMcpSession(McpSource source, ObjectMapper mapper, Process process) {
        this.source = source;
        this.mapper = mapper;
        this.jsonRpc = new JsonRpc(mapper);
        this.process = process;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    static StdioMcpSession spawn(McpSource source, ObjectMapper mapper) throws ToolSourceException {
        List<String> command = new ArrayList<>();
        command.add(source.command());
        command.addAll(source.args());
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.environment().putAll(source.env());
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw ToolSourceException.connection("Could not start MCP server '" + source.command() + "': " + e.getMessage(), e);
        }
        StdioMcpSession session = new StdioMcpSession(source, mapper, process);
        session.startReaders();
        return session;
    }

    @Override
    public McpSource source() {
        return source;
    }

    @Override
    public synchronized JsonNode request(String method, Object params) throws ToolSourceException {
        long id = ids.incrementAndGet();
        write(jsonRpc.createRequest(id, method, params));
        long deadline = System.nanoTime() + source.timeout().toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                JsonNode message = remaining <= 0 ? null : responses.poll(remaining, TimeUnit.NANOSECONDS);
                if (message == null) {
                    throw ToolSourceException.timeout("MCP " + method + " on " + source.name() + " timed out after "
                        + source.timeout().toMillis() + " ms", null);
                }
                if (message == END_OF_STREAM) {
                    responses.offer(END_OF_STREAM);
                    throw ToolSourceException.connection("MCP server " + source.name() + " closed its output", null);
                }
                if (JsonRpc.isResponseTo(message, id)) {
                    return jsonRpc.parseResult(message, method);
                }
                LOG.debug("Dropping stale MCP response from {}: {}", source.name(), message);
            }
        } catch (InterruptedException e) {
            throw TransportErrors.interrupted("MCP " + method + " on " + source.name(), e);
        }
    }

    @Override
    public synchronized void notify(String method, Object params) throws ToolSourceException {
        write(jsonRpc.createNotification(method, params));
    }

    @Override
    public void close() throws ToolSourceException {
        try {
            stdin.close();
        } catch (IOException e) {
            LOG.debug("Closing stdin of MCP server {} failed: {}", source.name(), e.getMessage());
        }
        try {
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                process.destroy();
                if (!process.waitFor(2, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw TransportErrors.interrupted("Stopping MCP server " + source.name(), e);
        }
    }

    private void write(String line) throws ToolSourceException {
        try {
            stdin.write(line);
            stdin.write('\n');
            stdin.flush();
        } catch (IOException e) {
            throw ToolSourceException.connection("Could not write to MCP server " + source.name() + ": " + e.getMessage(), e);
        }
    }

    private void startReaders() {
        Thread stdout = new Thread(this::readStdout, "toolbridge-mcp-" + source.name());
        stdout.setDaemon(true);
        stdout.start();
        Thread stderr = new Thread(this::readStderr, "toolbridge-mcp-" + source.name() + "-stderr");
        stderr.setDaemon(true);
        stderr.start();
    }

    private void readStdout() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    JsonNode message = mapper.readTree(line);
                    if (message.has("id") && (message.has("result") || message.has("error"))) {
                        responses.offer(message);
                    } else {
                        LOG.debug("MCP server {} sent {}", source.name(), message.path("method").asText("a non-response message"));
                    }
                } catch (JsonProcessingException e) {
                    LOG.debug("MCP server {} wrote non-JSON output: {}", source.name(), line);
                }
            }
        } catch (IOException e) {
            LOG.debug("Reading from MCP server {} stopped: {}", source.name(), e.getMessage());
        } finally {
            responses.offer(END_OF_STREAM);
        }
    }

    private void readStderr() {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.debug("[{}] {}", source.name(), line);
            }
        } catch (IOException e) {
            LOG.debug("Reading stderr of MCP server {} stopped: {}", source.name(), e.getMessage());
        }
    }
}
