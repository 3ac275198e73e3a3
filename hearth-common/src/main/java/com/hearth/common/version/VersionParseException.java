package com.hearth.common.version;

/**
 * Raised when a version string matches none of the requested strategies.
 */
public class VersionParseException extends RuntimeException {

    private final String raw;

    public VersionParseException(String raw, String message) {
        super(message);
        this.raw = raw;
    }

    public String getRaw() {
        return raw;
    }
}
