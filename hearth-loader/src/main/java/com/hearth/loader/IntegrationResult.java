package com.hearth.loader;

/**
 * Per-domain outcome of a batch integration lookup.
 */
public sealed interface IntegrationResult {

    record Found(Integration integration) implements IntegrationResult {
    }

    record Failed(LoaderException error) implements IntegrationResult {
    }

    default boolean isFound() {
        return this instanceof Found;
    }

    /**
     * The integration, or the recorded error thrown.
     */
    default Integration orThrow() {
        if (this instanceof Found found) {
            return found.integration();
        }
        throw ((Failed) this).error();
    }
}
