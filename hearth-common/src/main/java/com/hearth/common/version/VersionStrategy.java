package com.hearth.common.version;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Versioning schemes a version string may follow.
 */
public enum VersionStrategy {
    CALVER("^(\\d{2}|\\d{4})\\.(0?[1-9]|1[0-2])(\\.\\d{1,2})?(\\.?(b|dev)\\d+)?$"),
    SEMVER("^v?(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)"
            + "(?:-((?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*)(?:\\.(?:0|[1-9]\\d*|\\d*[a-zA-Z-][0-9a-zA-Z-]*))*))?"
            + "(?:\\+([0-9a-zA-Z-]+(?:\\.[0-9a-zA-Z-]+)*))?$"),
    SIMPLEVER("^v?\\d+(\\.\\d+)+$"),
    BUILDVER("^\\d+$"),
    PEP440("^v?(\\d+!)?\\d+(\\.\\d+)*((a|b|rc)\\d+)?(\\.post\\d+)?(\\.dev\\d+)?(\\+[a-z0-9]+(\\.[a-z0-9]+)*)?$");

    /** Every known strategy, in the order they are tried. */
    public static final List<VersionStrategy> ALL = List.of(values());

    private final Pattern pattern;

    VersionStrategy(String regex) {
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    public boolean matches(String raw) {
        return raw != null && pattern.matcher(raw).matches();
    }
}
