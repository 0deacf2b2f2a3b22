package io.kassa.core.config;

import java.nio.file.Path;
import java.util.Map;

public final class ConfigPaths {
    public static final String CONFIG_ENV = "KASSA_CONFIG";
    private static final String HOME_PREFIX = "~/";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return defaultConfigPath(System.getenv());
    }

    /**
     * {@code $KASSA_CONFIG} when set, else {@code ~/.kassa/config.json}.
     */
    public static Path defaultConfigPath(Map<String, String> env) {
        String override = env.get(CONFIG_ENV);
        return override == null || override.isBlank() ? kassaHome().resolve("config.json") : resolve(override);
    }

    /**
     * Expands a leading {@code ~/}; blank input falls back to the default database file.
     */
    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return kassaHome().resolve("merchant.db");
        }
        return rawPath.startsWith(HOME_PREFIX)
            ? userHome().resolve(rawPath.substring(HOME_PREFIX.length()))
            : Path.of(rawPath);
    }

    private static Path kassaHome() {
        return userHome().resolve(".kassa");
    }

    private static Path userHome() {
        return Path.of(System.getProperty("user.home"));
    }
}
