package com.hearth.loader;

/**
 * Raised for a domain that can never name an integration directory.
 */
public class InvalidDomainException extends LoaderException {

    private final String domain;

    public InvalidDomainException(String domain) {
        super("Invalid domain " + domain);
        this.domain = domain;
    }

    public String getDomain() {
        return domain;
    }
}
