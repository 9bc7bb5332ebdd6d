package io.toolbridge.transport.socket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSourceException;
import io.toolbridge.transport.Payloads;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Message shapes shared by the TCP and UDP sources. Requests are single JSON objects
 * ({@code {"type":"manual"}} or {@code {"tool":..., "arguments":...}}); a reply with an {@code error} member is a
 * remote failure, a reply with a {@code result} member yields that member, anything else is the result itself.
 */
final class SocketProtocol {
    private final ObjectMapper mapper;

    SocketProtocol(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String manualRequest() {
        return "{\"type\":\"manual\"}";
    }

    String callRequest(RawTool tool, Map<String, Object> arguments) throws ToolSourceException {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("tool", tool.rawName());
        request.put("arguments", arguments);
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw ToolSourceException.malformed("Arguments for tool " + tool.rawName() + " cannot be encoded", e);
        }
    }

    Object readReply(String reply, SourceDescriptor source, RawTool tool) throws ToolSourceException {
        if (reply == null) {
            throw ToolSourceException.connection("Source " + source.name() + " closed the connection without a reply", null);
        }
        JsonNode node;
        try {
            node = mapper.readTree(reply);
        } catch (JsonProcessingException e) {
            return Payloads.decode(reply, mapper);
        }
        if (node.isObject() && node.hasNonNull("error")) {
            JsonNode error = node.get("error");
            String message = error.isTextual() ? error.asText() : error.path("message").asText(error.toString());
            throw ToolSourceException.remote("Tool " + tool.rawName() + " on " + source.name() + " failed: " + message);
        }
        if (node.isObject() && node.has("result")) {
            return mapper.convertValue(node.get("result"), Object.class);
        }
        return mapper.convertValue(node, Object.class);
    }
}
