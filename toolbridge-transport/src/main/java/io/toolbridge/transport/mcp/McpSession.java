package io.toolbridge.transport.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import io.toolbridge.core.spi.ToolSession;
import io.toolbridge.core.spi.ToolSourceException;

/**
 * One negotiated connection to an MCP server. Requests on a session are serialized.
 */
interface McpSession extends ToolSession {

    /**
     * @return the {@code result} of the matching response
     */
    JsonNode request(String method, Object params) throws ToolSourceException;

    void notify(String method, Object params) throws ToolSourceException;

    void close() throws ToolSourceException;
}
