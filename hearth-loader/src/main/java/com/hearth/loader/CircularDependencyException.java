package com.hearth.loader;

/**
 * Raised when a circular dependency is found while resolving integrations.
 */
public class CircularDependencyException extends LoaderException {

    private final String fromDomain;
    private final String toDomain;

    public CircularDependencyException(String fromDomain, String toDomain) {
        super("Circular dependency detected: " + fromDomain + " -> " + toDomain + ".");
        this.fromDomain = fromDomain;
        this.toDomain = toDomain;
    }

    public String getFromDomain() {
        return fromDomain;
    }

    public String getToDomain() {
        return toDomain;
    }
}
