package com.hearth.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the Hearth configuration file.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, HearthConfig> cache;
    private final Path configDir;
    private final Path configPath;

    public ConfigService(Path configDir) {
        this(configDir, DEFAULT_CACHE_TTL);
    }

    public ConfigService(Path configDir, Duration cacheTtl) {
        this.configDir = configDir;
        this.configPath = ConfigPaths.resolveConfigFile(configDir);
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public HearthConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public HearthConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigDir() {
        return configDir;
    }

    public Path getConfigPath() {
        return configPath;
    }

    private HearthConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new HearthConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            HearthConfig config = applyDefaults(objectMapper.readValue(raw, HearthConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new HearthConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Map<String, String> env = System.getenv();
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.getOrDefault(varName,
                    defaultValue != null ? defaultValue : "");
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    HearthConfig applyDefaults(HearthConfig config) {
        if (config.getLoader() == null) {
            config.setLoader(new HearthConfig.LoaderConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new HearthConfig.LoggingConfig());
        }
        if (config.getIntegrations() == null) {
            config.setIntegrations(new ArrayList<>());
        }
        return config;
    }
}
