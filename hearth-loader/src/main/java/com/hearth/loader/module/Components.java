package com.hearth.loader.module;

import com.hearth.loader.ComponentImportException;
import com.hearth.loader.Integration;
import com.hearth.loader.IntegrationRegistry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Access to component modules by domain, for code that does not hold an
 * {@link Integration}. Lookups are memoized.
 */
public class Components {

    private final IntegrationRegistry registry;
    private final ModuleLoader moduleLoader;
    private final Map<String, ComponentHandle> components = new ConcurrentHashMap<>();

    public Components(IntegrationRegistry registry, ModuleLoader moduleLoader) {
        this.registry = registry;
        this.moduleLoader = moduleLoader;
    }

    /**
     * @throws ComponentImportException with "Unable to load X" when the
     *                                  component cannot be loaded
     */
    public ComponentHandle get(String name) {
        ComponentHandle cached = components.get(name);
        if (cached != null) {
            return cached;
        }
        ComponentHandle handle = load(name);
        ComponentHandle existing = components.putIfAbsent(name, handle);
        return existing != null ? existing : handle;
    }

    private ComponentHandle load(String name) {
        Optional<Integration> integration = registry.getCachedIntegration(name);
        if (integration.isPresent()) {
            try {
                return moduleLoader.getComponent(integration.get());
            } catch (ComponentImportException e) {
                throw new ComponentImportException(name, "Unable to load " + name, e);
            }
        }
        return moduleLoader.loadFile(name)
                .orElseThrow(() -> new ComponentImportException(name, "Unable to load " + name));
    }
}
