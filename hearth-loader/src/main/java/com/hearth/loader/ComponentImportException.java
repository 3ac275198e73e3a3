package com.hearth.loader;

/**
 * Raised when a component module cannot be found or fails while loading.
 */
public class ComponentImportException extends LoaderException {

    private final String moduleName;

    public ComponentImportException(String moduleName, String message) {
        super(message);
        this.moduleName = moduleName;
    }

    public ComponentImportException(String moduleName, String message, Throwable cause) {
        super(message, cause);
        this.moduleName = moduleName;
    }

    public String getModuleName() {
        return moduleName;
    }
}
