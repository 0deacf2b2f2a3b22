package io.kassa.cli;

import io.kassa.core.config.ConfigService;
import java.nio.file.Path;
import java.util.Map;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Map<String, String> environment,
    ServerRunner serverRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, System.getenv(), (port, host) -> {
            throw new UnsupportedOperationException("server runner is not configured");
        });
    }
}
