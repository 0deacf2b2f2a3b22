package io.kassa.cli;

import picocli.CommandLine.Command;

@Command(name = "kassa", mixinStandardHelpOptions = true, description = "Kassa merchant payment backend")
public final class KassaCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
