package com.hearth.loader.module;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * In-memory custom namespace.
 */
class MapNamespace implements ModuleNamespace {

    private final Map<String, Supplier<ComponentModule>> modules = new HashMap<>();
    boolean closed;

    MapNamespace put(String name, Supplier<ComponentModule> module) {
        modules.put(name, module);
        return this;
    }

    @Override
    public String name() {
        return "custom_integrations";
    }

    @Override
    public Optional<ComponentModule> find(String moduleName) {
        Supplier<ComponentModule> module = modules.get(moduleName);
        return module == null ? Optional.empty() : Optional.of(module.get());
    }

    @Override
    public void close() {
        closed = true;
    }
}
