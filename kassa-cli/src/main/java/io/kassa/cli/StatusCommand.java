package io.kassa.cli;

import io.kassa.core.config.ConfigPaths;
import io.kassa.core.config.model.ExchangeConfig;
import io.kassa.core.config.model.InstanceConfig;
import io.kassa.core.config.model.KassaConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            KassaConfig config = context.configService().applyEnvironment(
                context.configService().load(context.configPath()),
                context.environment()
            );
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Currency: " + config.merchant().currency());
            System.out.println("Listen: " + config.merchant().host() + ":" + config.merchant().port());
            System.out.println("Database: " + ConfigPaths.resolve(config.merchant().database()));
            System.out.println("Pay timeout: " + config.merchant().payTimeoutSeconds() + "s");
            for (InstanceConfig instance : config.instances()) {
                boolean keyed = instance.privateKey() != null && !instance.privateKey().isBlank();
                System.out.println("Instance " + instance.id() + ": key configured=" + keyed
                    + ", accounts=" + instance.accounts().size());
            }
            for (ExchangeConfig exchange : config.exchanges()) {
                System.out.println("Trusted exchange: " + exchange.url());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
