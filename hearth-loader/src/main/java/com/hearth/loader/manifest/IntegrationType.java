package com.hearth.loader.manifest;

import java.util.Locale;

/**
 * Classification of an integration, declared as {@code integration_type}.
 */
public enum IntegrationType {
    ENTITY("entity"),
    INTEGRATION("integration"),
    HARDWARE("hardware"),
    HELPER("helper"),
    SYSTEM("system");

    private final String label;

    IntegrationType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parse a manifest value; unknown or missing values mean {@link #INTEGRATION}.
     */
    public static IntegrationType fromString(String s) {
        if (s == null) {
            return INTEGRATION;
        }
        return switch (s.trim().toLowerCase(Locale.ROOT)) {
            case "entity" -> ENTITY;
            case "hardware" -> HARDWARE;
            case "helper" -> HELPER;
            case "system" -> SYSTEM;
            default -> INTEGRATION;
        };
    }
}
