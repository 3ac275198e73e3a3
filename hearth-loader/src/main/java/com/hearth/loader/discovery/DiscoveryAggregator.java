package com.hearth.loader.discovery;

import com.hearth.loader.HostContext;
import com.hearth.loader.Integration;
import com.hearth.loader.IntegrationRegistry;
import com.hearth.loader.manifest.IntegrationType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Discovery matcher tables: the built-in tables with the fragments of every
 * custom integration appended. Each table is built once per host.
 */
@Slf4j
public class DiscoveryAggregator {

    /** Zeroconf keys that used to be matched at the top level of an entry. */
    static final List<String> MOVED_ZEROCONF_PROPS = List.of("macaddress", "model", "manufacturer");

    private final HostContext host;
    private final IntegrationRegistry registry;
    private final BuiltinMatchers builtins;

    // loop thread only
    private final Map<String, CompletableFuture<?>> tables = new HashMap<>();

    public DiscoveryAggregator(HostContext host, IntegrationRegistry registry) {
        this(host, registry, BuiltinMatchers.load());
    }

    public DiscoveryAggregator(HostContext host, IntegrationRegistry registry, BuiltinMatchers builtins) {
        this.host = host;
        this.registry = registry;
        this.builtins = builtins;
    }

    // =========================================================================
    // Tables
    // =========================================================================

    /**
     * Zeroconf matchers keyed by service type.
     */
    public CompletableFuture<Map<String, List<Map<String, Object>>>> getZeroconf() {
        return cached("zeroconf", custom -> {
            Map<String, List<Map<String, Object>>> zeroconf = builtins.zeroconf();
            for (Integration integration : custom.values()) {
                for (Object entry : integration.getZeroconf()) {
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put("domain", integration.getDomain());
                    String type;
                    if (entry instanceof Map<?, ?> match) {
                        type = String.valueOf(match.get("type"));
                        data.putAll(processZeroconfMatch(match));
                    } else {
                        type = String.valueOf(entry);
                    }
                    zeroconf.computeIfAbsent(type, k -> new ArrayList<>()).add(data);
                }
            }
            return unmodifiableTable(zeroconf);
        });
    }

    public CompletableFuture<List<Map<String, Object>>> getBluetooth() {
        return cached("bluetooth", custom -> appendTagged(builtins.bluetooth(), custom, Integration::getBluetooth));
    }

    public CompletableFuture<List<Map<String, Object>>> getDhcp() {
        return cached("dhcp", custom -> appendTagged(builtins.dhcp(), custom, Integration::getDhcp));
    }

    /**
     * USB matchers. {@code known_devices} is documentation only and dropped.
     */
    public CompletableFuture<List<Map<String, Object>>> getUsb() {
        return cached("usb", custom -> {
            List<Map<String, Object>> usb = appendTagged(builtins.usb(), custom, Integration::getUsb);
            List<Map<String, Object>> stripped = new ArrayList<>(usb.size());
            for (Map<String, Object> matcher : usb) {
                if (matcher.containsKey("known_devices")) {
                    Map<String, Object> copy = new LinkedHashMap<>(matcher);
                    copy.remove("known_devices");
                    matcher = Collections.unmodifiableMap(copy);
                }
                stripped.add(matcher);
            }
            return Collections.unmodifiableList(stripped);
        });
    }

    /**
     * HomeKit model prefix to domain.
     */
    public CompletableFuture<Map<String, String>> getHomekit() {
        return cached("homekit", custom -> {
            Map<String, String> homekit = builtins.homekit();
            for (Integration integration : custom.values()) {
                List<String> models = integration.getHomekit().get("models");
                if (models == null) {
                    continue;
                }
                for (String model : models) {
                    homekit.put(model, integration.getDomain());
                }
            }
            return Collections.unmodifiableMap(homekit);
        });
    }

    /**
     * SSDP matchers keyed by domain.
     */
    public CompletableFuture<Map<String, List<Map<String, Object>>>> getSsdp() {
        return cached("ssdp", custom -> {
            Map<String, List<Map<String, Object>>> ssdp = builtins.ssdp();
            for (Integration integration : custom.values()) {
                if (!integration.getSsdp().isEmpty()) {
                    ssdp.put(integration.getDomain(), integration.getSsdp());
                }
            }
            return unmodifiableTable(ssdp);
        });
    }

    /**
     * MQTT discovery topics keyed by domain.
     */
    public CompletableFuture<Map<String, List<String>>> getMqtt() {
        return cached("mqtt", custom -> {
            Map<String, List<String>> mqtt = builtins.mqtt();
            for (Integration integration : custom.values()) {
                if (!integration.getMqtt().isEmpty()) {
                    mqtt.put(integration.getDomain(), integration.getMqtt());
                }
            }
            return unmodifiableTable(mqtt);
        });
    }

    public CompletableFuture<Set<String>> getConfigFlows() {
        return getConfigFlows(null);
    }

    /**
     * Domains offering a config flow, optionally limited to one integration type.
     */
    public CompletableFuture<Set<String>> getConfigFlows(IntegrationType typeFilter) {
        String key = typeFilter == null ? "config_flows" : "config_flows:" + typeFilter.label();
        return cached(key, custom -> {
            Set<String> flows = new LinkedHashSet<>();
            Map<String, List<String>> builtinFlows = builtins.configFlows();
            if (typeFilter != null) {
                flows.addAll(builtinFlows.getOrDefault(typeFilter.label(), List.of()));
            } else {
                builtinFlows.values().forEach(flows::addAll);
            }
            for (Integration integration : custom.values()) {
                if (integration.isConfigFlow()
                        && (typeFilter == null || integration.getIntegrationType() == typeFilter)) {
                    flows.add(integration.getDomain());
                }
            }
            return Collections.unmodifiableSet(flows);
        });
    }

    /**
     * Domains that support application credentials.
     */
    public CompletableFuture<List<String>> getApplicationCredentials() {
        return cached("application_credentials", custom -> {
            List<String> domains = builtins.applicationCredentials();
            for (Integration integration : custom.values()) {
                if (integration.getDependencies().contains("application_credentials")) {
                    domains.add(integration.getDomain());
                }
            }
            return Collections.unmodifiableList(domains);
        });
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Copy a zeroconf match object without its {@code type}, moving legacy
     * top-level property matchers into {@code properties}.
     */
    static Map<String, Object> processZeroconfMatch(Map<?, ?> entry) {
        Map<String, Object> match = new LinkedHashMap<>();
        entry.forEach((k, v) -> match.put(String.valueOf(k), v));
        match.remove("type");

        for (String movedProp : MOVED_ZEROCONF_PROPS) {
            Object value = match.remove(movedProp);
            if (value == null || "".equals(value)) {
                continue;
            }
            log.warn("Matching the zeroconf property \"{}\" at top-level is deprecated and should be "
                    + "moved into a properties dict; Check the developer documentation", movedProp);
            Map<String, Object> properties = new LinkedHashMap<>();
            if (match.get("properties") instanceof Map<?, ?> existing) {
                existing.forEach((k, v) -> properties.put(String.valueOf(k), v));
            }
            properties.put(movedProp, String.valueOf(value).toLowerCase(Locale.ROOT));
            match.put("properties", properties);
        }
        return match;
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> cached(String key, Function<Map<String, Integration>, T> build) {
        return host.runOnLoop(() -> (CompletableFuture<T>) tables.computeIfAbsent(key,
                k -> registry.getCustomIntegrations().thenApply(build)));
    }

    private static List<Map<String, Object>> appendTagged(List<Map<String, Object>> builtin,
            Map<String, Integration> custom, Function<Integration, List<Map<String, Object>>> fragments) {
        List<Map<String, Object>> matchers = new ArrayList<>(builtin);
        for (Integration integration : custom.values()) {
            for (Map<String, Object> entry : fragments.apply(integration)) {
                Map<String, Object> tagged = new LinkedHashMap<>();
                tagged.put("domain", integration.getDomain());
                tagged.putAll(entry);
                matchers.add(tagged);
            }
        }
        return Collections.unmodifiableList(matchers);
    }

    private static <V> Map<String, List<V>> unmodifiableTable(Map<String, List<V>> table) {
        Map<String, List<V>> copy = new LinkedHashMap<>();
        table.forEach((key, values) -> copy.put(key, Collections.unmodifiableList(values)));
        return Collections.unmodifiableMap(copy);
    }
}
