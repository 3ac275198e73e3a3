package com.hearth.loader.discovery;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discovery tables bundled with the loader. The parsed tree is never handed
 * out; every accessor returns a fresh mutable copy.
 */
@Slf4j
public class BuiltinMatchers {

    public static final String RESOURCE = "builtin_matchers.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, List<Map<String, Object>>>> MATCHERS_BY_KEY =
            new TypeReference<>() {
            };
    private static final TypeReference<List<Map<String, Object>>> MATCHER_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, List<String>>> STRING_LISTS = new TypeReference<>() {
    };
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final JsonNode tables;

    BuiltinMatchers(JsonNode tables) {
        this.tables = tables;
    }

    /**
     * Load the bundled tables from the classpath. A missing resource yields
     * empty tables.
     */
    public static BuiltinMatchers load() {
        return load(BuiltinMatchers.class.getClassLoader(), RESOURCE);
    }

    static BuiltinMatchers load(ClassLoader classLoader, String resource) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Built-in discovery tables {} not found on the classpath", resource);
                return new BuiltinMatchers(MissingNode.getInstance());
            }
            return new BuiltinMatchers(OBJECT_MAPPER.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read built-in discovery tables " + resource, e);
        }
    }

    // =========================================================================
    // Tables
    // =========================================================================

    public Map<String, List<Map<String, Object>>> zeroconf() {
        return table("zeroconf", MATCHERS_BY_KEY, new LinkedHashMap<>());
    }

    public Map<String, String> homekit() {
        return table("homekit", STRING_MAP, new LinkedHashMap<>());
    }

    public List<Map<String, Object>> bluetooth() {
        return table("bluetooth", MATCHER_LIST, new ArrayList<>());
    }

    public List<Map<String, Object>> dhcp() {
        return table("dhcp", MATCHER_LIST, new ArrayList<>());
    }

    public List<Map<String, Object>> usb() {
        return table("usb", MATCHER_LIST, new ArrayList<>());
    }

    public Map<String, List<Map<String, Object>>> ssdp() {
        return table("ssdp", MATCHERS_BY_KEY, new LinkedHashMap<>());
    }

    public Map<String, List<String>> mqtt() {
        return table("mqtt", STRING_LISTS, new LinkedHashMap<>());
    }

    /** Config flow domains keyed by integration type label. */
    public Map<String, List<String>> configFlows() {
        return table("config_flows", STRING_LISTS, new LinkedHashMap<>());
    }

    public List<String> applicationCredentials() {
        return table("application_credentials", STRING_LIST, new ArrayList<>());
    }

    private <T> T table(String name, TypeReference<T> type, T empty) {
        JsonNode node = tables.path(name);
        if (node.isMissingNode() || node.isNull()) {
            return empty;
        }
        return OBJECT_MAPPER.convertValue(node, type);
    }
}
