package io.toolbridge.cli;

import picocli.CommandLine.Command;

@Command(name = "toolbridge", mixinStandardHelpOptions = true, description = "Unified catalog and call interface for tool sources")
public final class ToolBridgeCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
