package io.toolbridge.transport.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.toolbridge.core.spi.ToolSourceException;

/**
 * JSON-RPC 2.0 framing for MCP messages.
 */
final class JsonRpc {
    private final ObjectMapper mapper;

    JsonRpc(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String createRequest(long id, String method, Object params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("id", id);
        root.put("method", method);
        root.set("params", mapper.valueToTree(params));
        return root.toString();
    }

    String createNotification(String method, Object params) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.put("method", method);
        if (params != null) {
            root.set("params", mapper.valueToTree(params));
        }
        return root.toString();
    }

    static boolean isResponseTo(JsonNode message, long id) {
        JsonNode idNode = message.get("id");
        return idNode != null && idNode.canConvertToLong() && idNode.asLong() == id
            && (message.has("result") || message.has("error"));
    }

    /**
     * @return the {@code result} member, or an empty object when absent
     * @throws ToolSourceException with {@code REMOTE_ERROR} when the response carries an {@code error}
     */
    JsonNode parseResult(JsonNode response, String method) throws ToolSourceException {
        JsonNode error = response.get("error");
        if (error != null && !error.isNull()) {
            String message = error.path("message").asText("Unknown error");
            int code = error.path("code").asInt(-1);
            throw ToolSourceException.remote("MCP " + method + " failed with JSON-RPC error " + code + ": " + message);
        }
        JsonNode result = response.get("result");
        return result == null || result.isNull() ? mapper.createObjectNode() : result;
    }
}
