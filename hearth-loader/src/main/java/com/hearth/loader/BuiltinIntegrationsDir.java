package com.hearth.loader;

import lombok.extern.slf4j.Slf4j;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resolve the bundled integrations directory.
 * Bundled integrations ship in an {@code integrations/} directory next to the
 * application.
 */
@Slf4j
public final class BuiltinIntegrationsDir {

    private BuiltinIntegrationsDir() {
    }

    /** Env var override for the bundled integrations directory. */
    static final String ENV_KEY = "HEARTH_BUILTIN_INTEGRATIONS_DIR";

    private static final String DIRNAME = "integrations";

    /**
     * Resolve the bundled integrations directory.
     * Search order:
     * 1. explicit setting
     * 2. HEARTH_BUILTIN_INTEGRATIONS_DIR env var
     * 3. integrations/ sibling of the application JAR
     * 4. integrations/ in current working directory
     *
     * @return the directory, or null when none exists
     */
    public static Path resolve(Path configured) {
        if (configured != null) {
            return configured;
        }

        String override = System.getenv(ENV_KEY);
        if (override != null && !override.isBlank()) {
            return Path.of(override.trim());
        }

        try {
            var codeSource = BuiltinIntegrationsDir.class.getProtectionDomain().getCodeSource();
            if (codeSource != null) {
                Path sibling = Path.of(codeSource.getLocation().toURI()).getParent().resolve(DIRNAME);
                if (Files.isDirectory(sibling)) {
                    return sibling;
                }
            }
        } catch (URISyntaxException | RuntimeException e) {
            log.debug("Could not resolve JAR sibling integrations dir: {}", e.getMessage());
        }

        Path cwd = Path.of(System.getProperty("user.dir"), DIRNAME);
        if (Files.isDirectory(cwd)) {
            return cwd;
        }

        return null;
    }
}
