package com.hearth.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration paths: config directory and config file.
 */
public final class ConfigPaths {

    private ConfigPaths() {
    }

    // =========================================================================
    // Directory / file name constants
    // =========================================================================

    private static final String CONFIG_DIRNAME = ".hearth";
    public static final String CONFIG_FILENAME = "hearth.json";
    public static final String CUSTOM_INTEGRATIONS_DIRNAME = "custom_integrations";

    // =========================================================================
    // Config directory
    // =========================================================================

    /**
     * Config directory holding {@code hearth.json} and custom integrations.
     * Can be overridden via HEARTH_CONFIG_DIR.
     * Default: ~/.hearth
     */
    public static Path resolveConfigDir() {
        return resolveConfigDir(System.getenv(), homeDir());
    }

    public static Path resolveConfigDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, "HEARTH_CONFIG_DIR");
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, CONFIG_DIRNAME);
    }

    /**
     * Config file inside the given config directory.
     */
    public static Path resolveConfigFile(Path configDir) {
        return configDir.resolve(CONFIG_FILENAME);
    }

    /**
     * Root that operators drop custom integrations into.
     */
    public static Path resolveCustomIntegrationsDir(Path configDir) {
        return configDir.resolve(CUSTOM_INTEGRATIONS_DIRNAME);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static Path resolveUserPath(String raw, String homedir) {
        String trimmed = raw.trim();
        if (trimmed.equals("~")) {
            return Path.of(homedir);
        }
        if (trimmed.startsWith("~/")) {
            return Path.of(homedir, trimmed.substring(2)).normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    private static String envTrimmed(Map<String, String> env, String key) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static String homeDir() {
        return System.getProperty("user.home");
    }
}
