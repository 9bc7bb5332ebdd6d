package io.toolbridge.transport.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.source.McpSource;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.Payloads;
import io.toolbridge.transport.TransportErrors;
import io.toolbridge.transport.http.SseEvent;
import io.toolbridge.transport.http.SseReader;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MCP over streamable HTTP: every message is POSTed to the server URL, replies come back as JSON or as an
 * event stream. The {@code Mcp-Session-Id} handed out on initialize is echoed on every later request.
 */
final class HttpMcpSession implements McpSession {
    private static final Logger LOG = LoggerFactory.getLogger(HttpMcpSession.class);
    private static final MediaType JSON = MediaType.get("application/json");
    private static final String SESSION_HEADER = "Mcp-Session-Id";

    private final McpSource source;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final JsonRpc jsonRpc;
    private final AtomicLong ids = new AtomicLong();
    private volatile String sessionId;

    HttpMcpSession(McpSource source, OkHttpClient client, ObjectMapper mapper) {
        this.source = source;
        this.client = client.newBuilder().callTimeout(source.timeout()).build();
        this.mapper = mapper;
        this.jsonRpc = new JsonRpc(mapper);
    }

    @Override
    public McpSource source() {
        return source;
    }

    @Override
    public synchronized JsonNode request(String method, Object params) throws ToolSourceException {
        long id = ids.incrementAndGet();
        try (Response response = client.newCall(post(jsonRpc.createRequest(id, method, params))).execute()) {
            String assigned = response.header(SESSION_HEADER);
            if (assigned != null && !assigned.isBlank()) {
                sessionId = assigned;
            }
            if (!response.isSuccessful()) {
                String raw = response.body() == null ? "" : response.body().string();
                throw ToolSourceException.remote("MCP " + method + " on " + source.name() + " answered HTTP "
                    + response.code() + " " + Payloads.snippet(raw));
            }
            return jsonRpc.parseResult(readResponse(response, id, method), method);
        } catch (IOException e) {
            throw TransportErrors.translate("MCP " + method + " on " + source.name(), e);
        }
    }

    @Override
    public synchronized void notify(String method, Object params) throws ToolSourceException {
        try (Response response = client.newCall(post(jsonRpc.createNotification(method, params))).execute()) {
            if (!response.isSuccessful()) {
                throw ToolSourceException.remote("MCP notification " + method + " on " + source.name()
                    + " answered HTTP " + response.code());
            }
        } catch (IOException e) {
            throw TransportErrors.translate("MCP notification " + method + " on " + source.name(), e);
        }
    }

    @Override
    public void close() throws ToolSourceException {
        String id = sessionId;
        if (id == null) {
            return;
        }
        Request request = withHeaders(new Request.Builder().url(source.url()).delete()).build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful() && response.code() != 404 && response.code() != 405) {
                throw ToolSourceException.remote("Closing MCP session on " + source.name() + " answered HTTP " + response.code());
            }
            LOG.debug("Closed MCP session {} on {}", id, source.name());
        } catch (IOException e) {
            throw TransportErrors.translate("Closing MCP session on " + source.name(), e);
        }
    }

    private Request post(String payload) {
        Request.Builder builder = new Request.Builder()
            .url(source.url())
            .header("Accept", "application/json, text/event-stream")
            .post(RequestBody.create(payload, JSON));
        return withHeaders(builder).build();
    }

    private Request.Builder withHeaders(Request.Builder builder) {
        source.headers().forEach(builder::header);
        String id = sessionId;
        if (id != null) {
            builder.header(SESSION_HEADER, id);
        }
        return builder;
    }

    private JsonNode readResponse(Response response, long id, String method) throws IOException, ToolSourceException {
        String contentType = response.header("Content-Type", "").toLowerCase(Locale.ROOT);
        if (response.body() == null) {
            throw ToolSourceException.malformed("MCP " + method + " on " + source.name() + " returned no body", null);
        }
        if (!contentType.contains("text/event-stream")) {
            return mapper.readTree(response.body().string());
        }
        for (SseEvent event : SseReader.readAll(response.body().source())) {
            JsonNode message = mapper.readTree(event.data());
            if (JsonRpc.isResponseTo(message, id)) {
                return message;
            }
        }
        throw ToolSourceException.malformed("MCP " + method + " on " + source.name() + " sent no response in its event stream", null);
    }
}
