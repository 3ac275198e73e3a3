package com.hearth.common.version;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Version parsing against a set of versioning strategies.
 */
public final class VersionParser {

    private VersionParser() {
    }

    /**
     * Parse a version string, accepting the first strategy that matches.
     *
     * @param raw        version string like "1.2.3", "2023.1" or "1.0rc1"
     * @param strategies strategies to try, in order
     * @return parsed version
     * @throws VersionParseException if the string is blank or no strategy
     *                               matches
     */
    public static Version parse(String raw, List<VersionStrategy> strategies) {
        if (raw == null || raw.isBlank()) {
            throw new VersionParseException(raw, "version is empty");
        }
        String trimmed = raw.trim();
        for (VersionStrategy strategy : strategies) {
            if (strategy.matches(trimmed)) {
                return new Version(trimmed, strategy);
            }
        }
        throw new VersionParseException(trimmed, "'" + trimmed + "' does not match any of "
                + strategies.stream().map(Enum::name).collect(Collectors.joining(", ")));
    }

    /**
     * Parse against every known strategy.
     */
    public static Version parse(String raw) {
        return parse(raw, VersionStrategy.ALL);
    }

    /**
     * Compare two version strings.
     *
     * @return negative if a &lt; b, positive if a &gt; b, 0 if equal, null if
     *         either is invalid
     */
    public static Integer compare(String a, String b) {
        try {
            return Integer.signum(parse(a).compareTo(parse(b)));
        } catch (VersionParseException e) {
            return null;
        }
    }
}
