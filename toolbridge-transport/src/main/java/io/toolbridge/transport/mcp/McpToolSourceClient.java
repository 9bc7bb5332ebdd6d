package io.toolbridge.transport.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.McpSource;
import io.toolbridge.core.source.ProtocolKind;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceClient;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.Payloads;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class McpToolSourceClient implements ToolSourceClient {
    private static final Logger LOG = LoggerFactory.getLogger(McpToolSourceClient.class);
    static final String PROTOCOL_VERSION = "2024-11-05";

    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public McpToolSourceClient(OkHttpClient client, ObjectMapper mapper) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.MCP;
    }

    @Override
    public boolean requiresSession() {
        return true;
    }

    @Override
    public ToolSession openSession(SourceDescriptor source) throws ToolSourceException {
        McpSource mcp = (McpSource) source;
        McpSession session = mcp.stdio() ? StdioMcpSession.spawn(mcp, mapper) : new HttpMcpSession(mcp, client, mapper);
        try {
            JsonNode initialized = session.request("initialize", Map.of(
                "protocolVersion", PROTOCOL_VERSION,
                "capabilities", Map.of(),
                "clientInfo", Map.of("name", "toolbridge", "version", "0.1.0")
            ));
            session.notify("notifications/initialized", null);
            LOG.debug("MCP session with {} initialized ({} {})", source.name(),
                initialized.path("serverInfo").path("name").asText("unknown server"),
                initialized.path("protocolVersion").asText(""));
            return session;
        } catch (ToolSourceException | RuntimeException e) {
            try {
                session.close();
            } catch (ToolSourceException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    @Override
    public void closeSession(ToolSession session) throws ToolSourceException {
        mcpSession(session).close();
    }

    @Override
    public List<RawTool> discover(SourceDescriptor source, ToolSession session) throws ToolSourceException {
        McpSession mcp = mcpSession(session);
        List<RawTool> tools = new ArrayList<>();
        String cursor = null;
        do {
            JsonNode result = mcp.request("tools/list", cursor == null ? Map.of() : Map.of("cursor", cursor));
            JsonNode listed = result.path("tools");
            if (!listed.isArray()) {
                throw ToolSourceException.malformed("MCP tools/list on " + source.name() + " returned no tools array", null);
            }
            for (JsonNode tool : listed) {
                tools.add(new RawTool(
                    tool.path("name").asText(),
                    tool.path("description").asText(""),
                    plain(tool.get("inputSchema")),
                    plain(tool.get("outputSchema")),
                    Map.of(),
                    source
                ));
            }
            String next = result.path("nextCursor").asText("");
            cursor = next.isBlank() ? null : next;
        } while (cursor != null);
        return tools;
    }

    @Override
    public Object invoke(SourceDescriptor source, ToolSession session, RawTool tool, Map<String, Object> arguments)
        throws ToolSourceException {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", tool.rawName());
        params.put("arguments", arguments);
        JsonNode result = mcpSession(session).request("tools/call", params);

        List<String> texts = new ArrayList<>();
        boolean textOnly = true;
        for (JsonNode item : result.path("content")) {
            if ("text".equals(item.path("type").asText())) {
                texts.add(item.path("text").asText());
            } else {
                textOnly = false;
            }
        }
        if (result.path("isError").asBoolean(false)) {
            String message = texts.isEmpty() ? "no detail" : String.join("\n", texts);
            throw ToolSourceException.remote("Tool " + tool.rawName() + " reported an error: " + message);
        }
        JsonNode structured = result.get("structuredContent");
        if (structured != null && !structured.isNull()) {
            return plain(structured);
        }
        if (!textOnly) {
            return plain(result.path("content"));
        }
        if (texts.size() == 1) {
            return Payloads.decode(texts.get(0), mapper);
        }
        List<Object> decoded = new ArrayList<>(texts.size());
        for (String text : texts) {
            decoded.add(Payloads.decode(text, mapper));
        }
        return decoded;
    }

    private Object plain(JsonNode node) {
        return node == null || node.isNull() ? null : mapper.convertValue(node, Object.class);
    }

    private static McpSession mcpSession(ToolSession session) {
        if (!(session instanceof McpSession mcp)) {
            throw new IllegalArgumentException("Not an MCP session: " + session);
        }
        return mcp;
    }
}
