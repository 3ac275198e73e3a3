package com.hearth.loader.module;

import com.hearth.loader.ComponentImportException;

import java.util.Optional;

/**
 * A place component modules are looked up in by name.
 */
public interface ModuleNamespace extends AutoCloseable {

    /** Package-style name of the namespace, e.g. {@code custom_integrations}. */
    String name();

    /**
     * Find and instantiate a module.
     *
     * @return the module, or empty when the namespace has no module of that name
     * @throws ComponentImportException if the module exists but cannot be loaded
     */
    Optional<ComponentModule> find(String moduleName);

    @Override
    default void close() {
    }
}
