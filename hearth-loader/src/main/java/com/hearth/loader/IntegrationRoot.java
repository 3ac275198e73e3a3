package com.hearth.loader;

import java.nio.file.Path;
import java.util.List;

/**
 * A search location for integrations: one sub directory per domain under
 * each base path.
 *
 * @param name      package-style name, prefixed to the domain to form an
 *                  integration's package path
 * @param basePaths directories searched in order
 * @param builtIn   whether integrations found here are bundled and trusted
 */
public record IntegrationRoot(String name, List<Path> basePaths, boolean builtIn) {

    public static final String PACKAGE_CUSTOM = "custom_integrations";
    public static final String PACKAGE_BUILTIN = "hearth.integrations";

    public IntegrationRoot {
        basePaths = List.copyOf(basePaths);
    }

    public static IntegrationRoot custom(Path dir) {
        return new IntegrationRoot(PACKAGE_CUSTOM, List.of(dir), false);
    }

    public static IntegrationRoot builtin(Path dir) {
        return new IntegrationRoot(PACKAGE_BUILTIN, dir == null ? List.of() : List.of(dir), true);
    }

    public String packagePath(String domain) {
        return name + "." + domain;
    }
}
