package com.hearth.loader;

import com.hearth.common.config.ConfigPaths;
import com.hearth.common.config.HearthConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Host settings the loader depends on.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoaderSettings {

    public static final int MAX_LOAD_CONCURRENTLY = 4;

    /** Config directory; without it no integration can be loaded. */
    private Path configDir;

    /** Disables custom integration discovery entirely. */
    private boolean safeMode;

    /** Bundled integrations directory; resolved by {@link BuiltinIntegrationsDir} when null. */
    private Path builtinDir;

    @Builder.Default
    private int maxLoadConcurrently = MAX_LOAD_CONCURRENTLY;

    /**
     * Derive loader settings from the host configuration.
     */
    public static LoaderSettings fromConfig(HearthConfig config, Path configDir) {
        LoaderSettings.LoaderSettingsBuilder builder = LoaderSettings.builder()
                .configDir(configDir)
                .safeMode(config.isSafeMode());
        HearthConfig.LoaderConfig loader = config.getLoader();
        if (loader != null) {
            if (loader.getBuiltinDir() != null && !loader.getBuiltinDir().isBlank()) {
                builder.builtinDir(Path.of(loader.getBuiltinDir().trim()));
            }
            if (loader.getMaxLoadConcurrently() != null && loader.getMaxLoadConcurrently() > 0) {
                builder.maxLoadConcurrently(loader.getMaxLoadConcurrently());
            }
        }
        return builder.build();
    }

    /**
     * Directory holding custom integrations, or null without a config dir.
     */
    public Path customRoot() {
        return configDir == null ? null : ConfigPaths.resolveCustomIntegrationsDir(configDir);
    }
}
