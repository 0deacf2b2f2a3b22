package io.kassa.cli;

import io.kassa.core.config.ConfigPaths;
import io.kassa.core.config.ConfigService;
import io.kassa.core.db.SqliteMerchantDb;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "dbinit", description = "Create config, default instance key and database tables")
public final class DbInitCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = "--reset", description = "Drop all merchant tables before recreating them")
    boolean reset;

    public DbInitCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ConfigService.InitResult result = context.configService().initialize(context.configPath(), new SecureRandom());
            if (result.createdConfig()) {
                System.out.println("Created config: " + result.configPath());
            }
            if (result.generatedKey()) {
                System.out.println("Generated key for instance 'default'");
            }
            var config = context.configService().applyEnvironment(result.config(), context.environment());
            Path database = ConfigPaths.resolve(config.merchant().database());
            try (SqliteMerchantDb db = new SqliteMerchantDb(database)) {
                if (reset) {
                    db.reset();
                    System.out.println("Reset database: " + database);
                } else {
                    System.out.println("Database ready: " + database);
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Database initialization failed: " + e.getMessage());
            return 1;
        }
    }
}
