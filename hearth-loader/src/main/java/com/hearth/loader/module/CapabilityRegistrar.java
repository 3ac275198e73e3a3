package com.hearth.loader.module;

/**
 * Collects the callables a {@link ComponentModule} exposes.
 */
public interface CapabilityRegistrar {

    void function(String name, ComponentFunction function);

    /**
     * Register a function that receives the host context as its first argument.
     */
    void hostBound(String name, HostBoundFunction function);
}
