package io.toolbridge.core.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.toolbridge.core.error.ToolAdapterException;
import io.toolbridge.core.model.AdaptedTool;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host-side handle on one adapted tool; every call goes back through the adapter by adapted name.
 */
public final class AdaptedToolHandle implements Tool {
    private static final Logger LOG = LoggerFactory.getLogger(AdaptedToolHandle.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AdaptedTool tool;
    private final BiFunction<String, Map<String, Object>, Object> caller;

    public AdaptedToolHandle(AdaptedTool tool, BiFunction<String, Map<String, Object>, Object> caller) {
        this.tool = Objects.requireNonNull(tool, "tool must not be null");
        this.caller = Objects.requireNonNull(caller, "caller must not be null");
    }

    @Override
    public String name() {
        return tool.adaptedName();
    }

    @Override
    public String description() {
        return tool.description();
    }

    @Override
    public Map<String, Object> schema() {
        return tool.inputSchema();
    }

    @Override
    public Object invoke(Map<String, Object> arguments) {
        return caller.apply(tool.adaptedName(), arguments);
    }

    /**
     * Runs one host tool-use request. Adapter errors become an error result instead of propagating.
     */
    public ToolResult run(ToolUse use) {
        Objects.requireNonNull(use, "use must not be null");
        try {
            return ToolResult.success(use.toolUseId(), format(invoke(use.input())));
        } catch (ToolAdapterException e) {
            LOG.warn("Tool {} failed for tool use {}: {}", name(), use.toolUseId(), e.getMessage());
            return ToolResult.error(use.toolUseId(), e.getMessage());
        }
    }

    public AdaptedTool adaptedTool() {
        return tool;
    }

    static String format(Object result) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence text) {
            return text.toString();
        }
        if (result instanceof Number || result instanceof Boolean) {
            return String.valueOf(result);
        }
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            return String.valueOf(result);
        }
    }
}
