package com.hearth.loader;

/**
 * Base type for integration loader errors.
 */
public class LoaderException extends RuntimeException {

    public LoaderException(String message) {
        super(message);
    }

    public LoaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
