package io.toolbridge.core.tool;

import java.util.Map;

/**
 * What a host agent framework sees of one adapted tool.
 */
public interface Tool {
    String name();

    String description();

    Map<String, Object> schema();

    Object invoke(Map<String, Object> arguments);
}
