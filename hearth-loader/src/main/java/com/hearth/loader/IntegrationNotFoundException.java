package com.hearth.loader;

/**
 * Raised when an integration cannot be found on any root, or failed to load.
 */
public class IntegrationNotFoundException extends LoaderException {

    private final String domain;

    public IntegrationNotFoundException(String domain) {
        super("Integration '" + domain + "' not found.");
        this.domain = domain;
    }

    public IntegrationNotFoundException(String domain, Throwable cause) {
        super("Integration '" + domain + "' not found.", cause);
        this.domain = domain;
    }

    public String getDomain() {
        return domain;
    }
}
