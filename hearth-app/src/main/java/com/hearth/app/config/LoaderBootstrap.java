package com.hearth.app.config;

import com.hearth.common.config.ConfigService;
import com.hearth.common.config.HearthConfig;
import com.hearth.loader.HostContext;
import com.hearth.loader.Integration;
import com.hearth.loader.IntegrationResult;
import com.hearth.loader.LoaderSettings;
import com.hearth.loader.discovery.DiscoveryAggregator;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Application-level loader bootstrap: creates the host context, loads the
 * integrations listed in the config and resolves their dependencies.
 * Failures are logged and never abort startup.
 */
@Slf4j
@Component
public class LoaderBootstrap {

    private final ConfigService configService;
    private HostContext hostContext;

    public LoaderBootstrap(ConfigService configService) {
        this.configService = configService;
    }

    @PostConstruct
    public void init() {
        try {
            HearthConfig config = configService.loadConfig();
            applyLogLevel(config);
            LoaderSettings settings = LoaderSettings.fromConfig(config, configService.getConfigDir());
            this.hostContext = HostContext.create(settings);
            log.info("Integration loader started (configDir={}, safeMode={}, builtinDir={})",
                    settings.getConfigDir(), settings.isSafeMode(), hostContext.getBuiltinRoot().basePaths());

            List<Integration> loaded = loadIntegrations(config.getIntegrations());
            int resolved = resolveDependencies(loaded);
            log.info("Integrations loaded: {} requested, {} loaded, {} with dependencies resolved",
                    config.getIntegrations().size(), loaded.size(), resolved);

            logDiscoveryTables();
        } catch (Exception e) {
            log.warn("Failed to load integrations: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (hostContext != null) {
            hostContext.close();
            hostContext = null;
        }
    }

    /** The running host context, or null when startup failed. */
    public HostContext getHostContext() {
        return hostContext;
    }

    private static void applyLogLevel(HearthConfig config) {
        if (config.getLogging() == null || config.getLogging().getLevel() == null) {
            return;
        }
        try {
            LogLevel level = LogLevel.valueOf(config.getLogging().getLevel().trim().toUpperCase(Locale.ROOT));
            LoggingSystem.get(LoaderBootstrap.class.getClassLoader()).setLogLevel("com.hearth", level);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown log level '{}'", config.getLogging().getLevel());
        }
    }

    private List<Integration> loadIntegrations(List<String> domains) {
        List<Integration> loaded = new ArrayList<>();
        if (domains.isEmpty()) {
            return loaded;
        }
        Map<String, IntegrationResult> results = hostContext.getRegistry().getIntegrations(domains).join();
        results.forEach((domain, result) -> {
            if (result instanceof IntegrationResult.Found found) {
                loaded.add(found.integration());
            } else {
                log.warn("Skipping integration {}: {}", domain, ((IntegrationResult.Failed) result).error().getMessage());
            }
        });
        return loaded;
    }

    private int resolveDependencies(List<Integration> integrations) {
        int resolved = 0;
        for (Integration integration : integrations) {
            if (hostContext.getDependencyResolver().resolve(integration).join()) {
                resolved++;
            }
        }
        return resolved;
    }

    private void logDiscoveryTables() {
        DiscoveryAggregator discovery = hostContext.getDiscovery();
        log.info("Discovery tables: zeroconf={}, ssdp={}, bluetooth={}, dhcp={}, usb={}, homekit={}, mqtt={}",
                discovery.getZeroconf().join().size(),
                discovery.getSsdp().join().size(),
                discovery.getBluetooth().join().size(),
                discovery.getDhcp().join().size(),
                discovery.getUsb().join().size(),
                discovery.getHomekit().join().size(),
                discovery.getMqtt().join().size());
    }
}
