package io.assistify.cli;

import picocli.CommandLine.Command;

@Command(name = "assistify", mixinStandardHelpOptions = true, description = "Store assistant with pluggable AI providers")
public final class AssistifyCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
