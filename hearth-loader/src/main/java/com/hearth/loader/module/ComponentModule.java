package com.hearth.loader.module;

import java.util.List;

/**
 * A loadable unit of integration code.
 *
 * <p>
 * Implementations are discovered via Java SPI (ServiceLoader), must be
 * annotated with {@link ModuleName} and need a public no-arg constructor.
 * </p>
 */
public interface ComponentModule {

    /**
     * Called once, when the module's capability table is first needed.
     */
    void declare(CapabilityRegistrar registrar);

    /** Domains this module needs loaded first, for modules without a manifest. */
    default List<String> dependencies() {
        return List.of();
    }

    /** Requirements of a module without a manifest. */
    default List<String> requirements() {
        return List.of();
    }
}
