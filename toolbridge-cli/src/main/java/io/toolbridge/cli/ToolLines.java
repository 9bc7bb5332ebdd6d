package io.toolbridge.cli;

import io.toolbridge.core.model.AdaptedTool;

final class ToolLines {

    private ToolLines() {
    }

    static String describe(AdaptedTool tool) {
        return tool.adaptedName() + " [" + tool.source().name() + "] - " + tool.description();
    }
}
