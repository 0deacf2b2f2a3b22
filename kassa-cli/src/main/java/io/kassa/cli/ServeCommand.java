package io.kassa.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "serve", description = "Start the merchant HTTP backend (/pay, /refund, /poll-payment)")
public final class ServeCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "Listen port, overrides the configured one")
    Integer port;

    @Option(names = {"--host"}, description = "Listen address, overrides the configured one")
    String host;

    public ServeCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.serverRunner().run(port, host);
        } catch (Exception e) {
            System.err.println("Serve command failed: " + e.getMessage());
            return 1;
        }
    }
}
