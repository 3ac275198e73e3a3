package com.hearth.app.config;

import com.hearth.common.config.ConfigPaths;
import com.hearth.common.config.ConfigService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the loader's collaborators.
 */
@Configuration
public class LoaderBeanConfig {

    @Value("${hearth.config.dir:}")
    private String configDir;

    @Bean
    public ConfigService configService() {
        if (configDir == null || configDir.isBlank()) {
            return new ConfigService(ConfigPaths.resolveConfigDir());
        }
        String resolved = configDir.trim();
        if (resolved.startsWith("~")) {
            resolved = System.getProperty("user.home") + resolved.substring(1);
        }
        return new ConfigService(Path.of(resolved));
    }
}
