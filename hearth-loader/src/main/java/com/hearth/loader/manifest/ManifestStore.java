package com.hearth.loader.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Manifest parsing into the typed {@link Manifest}.
 */
public final class ManifestStore {

    private ManifestStore() {
    }

    public static final String MANIFEST_FILENAME = "manifest.json";
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> RAW_TYPE = new TypeReference<>() {
    };

    // =========================================================================
    // Load result
    // =========================================================================

    public sealed interface ManifestLoadResult {
        record Success(Manifest manifest, Path manifestPath) implements ManifestLoadResult {
        }

        record Failure(String error, Path manifestPath) implements ManifestLoadResult {
        }
    }

    // =========================================================================
    // Parsing
    // =========================================================================

    /**
     * Parse the JSON text of a manifest file.
     */
    public static ManifestLoadResult parse(String json, Path manifestPath) {
        Map<String, Object> raw;
        try {
            raw = OBJECT_MAPPER.readValue(json, RAW_TYPE);
        } catch (JsonProcessingException e) {
            return new ManifestLoadResult.Failure(
                    "failed to parse manifest: " + e.getOriginalMessage(), manifestPath);
        }
        if (raw == null) {
            return new ManifestLoadResult.Failure("manifest is empty", manifestPath);
        }

        String domain = raw.get("domain") instanceof String s ? s.trim() : "";
        if (domain.isEmpty()) {
            return new ManifestLoadResult.Failure("manifest requires domain", manifestPath);
        }
        return new ManifestLoadResult.Success(fromMap(domain, raw), manifestPath);
    }

    /**
     * Manifest for a module that predates manifest files.
     */
    public static Manifest legacy(String domain, List<String> dependencies, List<String> requirements) {
        return Manifest.builder()
                .domain(domain)
                .name(domain)
                .dependencies(List.copyOf(dependencies))
                .requirements(List.copyOf(requirements))
                .build();
    }

    private static Manifest fromMap(String domain, Map<String, Object> raw) {
        String name = raw.get("name") instanceof String s && !s.isBlank() ? s.trim() : domain;
        return Manifest.builder()
                .domain(domain)
                .name(name)
                .disabled(stringOrNull(raw.get("disabled")))
                .integrationType(IntegrationType.fromString(stringOrNull(raw.get("integration_type"))))
                .dependencies(normalizeStringList(raw.get("dependencies")))
                .afterDependencies(normalizeStringList(raw.get("after_dependencies")))
                .requirements(normalizeStringList(raw.get("requirements")))
                .configFlow(Boolean.TRUE.equals(raw.get("config_flow")))
                .documentation(stringOrNull(raw.get("documentation")))
                .issueTracker(stringOrNull(raw.get("issue_tracker")))
                .qualityScale(stringOrNull(raw.get("quality_scale")))
                .iotClass(stringOrNull(raw.get("iot_class")))
                .version(versionOrNull(raw.get("version")))
                .codeowners(normalizeStringList(raw.get("codeowners")))
                .loggers(normalizeStringList(raw.get("loggers")))
                .zeroconf(zeroconfEntries(raw.get("zeroconf")))
                .ssdp(objectList(raw.get("ssdp")))
                .bluetooth(objectList(raw.get("bluetooth")))
                .dhcp(objectList(raw.get("dhcp")))
                .usb(objectList(raw.get("usb")))
                .homekit(homekit(raw.get("homekit")))
                .mqtt(normalizeStringList(raw.get("mqtt")))
                .build();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static List<String> normalizeStringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(String.class::isInstance)
                .map(e -> ((String) e).trim())
                .filter(s -> !s.isEmpty())
                .toList();
    }

    private static String stringOrNull(Object value) {
        return value instanceof String s ? s.trim() : null;
    }

    // Numeric versions such as 1 or 1.5 are kept as their text.
    private static String versionOrNull(Object value) {
        if (value instanceof String s) {
            return s.trim();
        }
        return value instanceof Number n ? n.toString() : null;
    }

    private static List<Map<String, Object>> objectList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(Map.class::isInstance)
                .map(ManifestStore::copyObject)
                .toList();
    }

    private static List<Object> zeroconfEntries(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(e -> e instanceof String || (e instanceof Map<?, ?> m && m.get("type") instanceof String))
                .map(e -> e instanceof Map<?, ?> ? (Object) copyObject(e) : e)
                .toList();
    }

    private static Map<String, List<String>> homekit(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return Map.of();
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        map.forEach((k, v) -> result.put(String.valueOf(k), normalizeStringList(v)));
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, Object> copyObject(Object value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), v));
        return Collections.unmodifiableMap(copy);
    }
}
