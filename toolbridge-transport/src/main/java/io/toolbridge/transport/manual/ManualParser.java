package io.toolbridge.transport.manual;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.model.RawTool;
import io.toolbridge.core.source.SourceDescriptor;
import io.toolbridge.core.spi.ToolSourceException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a tool manual: {@code {"tools": [{"name", "description", "inputs", "outputs", "tool_call_template"}]}}.
 * A bare array of tools is accepted too, as are the MCP field names {@code inputSchema} and {@code outputSchema}.
 */
public final class ManualParser {
    private static final Logger LOG = LoggerFactory.getLogger(ManualParser.class);
    private static final List<String> INPUT_FIELDS = List.of("inputs", "inputSchema", "input_schema", "parameters");
    private static final List<String> OUTPUT_FIELDS = List.of("outputs", "outputSchema", "output_schema");
    private static final List<String> TEMPLATE_FIELDS = List.of("tool_call_template", "call_template", "tool_provider");

    private final ObjectMapper mapper;

    public ManualParser(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public List<RawTool> parse(String manual, SourceDescriptor source) throws ToolSourceException {
        if (manual == null || manual.isBlank()) {
            throw ToolSourceException.malformed("Source " + source.name() + " returned an empty manual", null);
        }
        try {
            return parse(mapper.readTree(manual), source);
        } catch (JsonProcessingException e) {
            throw ToolSourceException.malformed("Source " + source.name() + " returned an unreadable manual: "
                + e.getOriginalMessage(), e);
        }
    }

    public List<RawTool> parse(JsonNode manual, SourceDescriptor source) throws ToolSourceException {
        JsonNode tools = manual == null ? null : manual.isArray() ? manual : manual.get("tools");
        if (tools == null || !tools.isArray()) {
            throw ToolSourceException.malformed("Source " + source.name() + " returned a manual without a tools array", null);
        }

        List<RawTool> parsed = new ArrayList<>(tools.size());
        for (JsonNode tool : tools) {
            String name = tool.path("name").asText("");
            if (name.isBlank()) {
                LOG.warn("Source {} listed a tool without a name, skipping it", source.name());
                continue;
            }
            parsed.add(new RawTool(
                name,
                tool.path("description").asText(""),
                plain(first(tool, INPUT_FIELDS)),
                plain(first(tool, OUTPUT_FIELDS)),
                template(first(tool, TEMPLATE_FIELDS)),
                source
            ));
        }
        return parsed;
    }

    private static JsonNode first(JsonNode tool, List<String> fields) {
        for (String field : fields) {
            JsonNode value = tool.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private Object plain(JsonNode node) {
        return node == null ? null : mapper.convertValue(node, Object.class);
    }

    private Map<String, Object> template(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return mapper.convertValue(node, new TypeReference<Map<String, Object>>() {});
    }
}
