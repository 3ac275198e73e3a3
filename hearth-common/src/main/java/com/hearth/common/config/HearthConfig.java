package com.hearth.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for Hearth, read from {@code hearth.json} in the
 * config directory.
 */
@Data
public class HearthConfig {

    /** When set, custom integrations are never discovered or loaded. */
    private boolean safeMode;

    /** Integration domains loaded at startup. */
    private List<String> integrations = new ArrayList<>();

    /** Loader settings. */
    private LoaderConfig loader;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class LoaderConfig {
        /** Overrides the bundled integrations directory. */
        private String builtinDir;

        /** Upper bound on concurrent manifest resolutions. */
        private Integer maxLoadConcurrently;
    }

    @Data
    public static class LoggingConfig {
        private String level = "info";
    }
}
