package com.hearth.loader.module;

import com.hearth.loader.ComponentImportException;
import com.hearth.loader.HostContext;
import com.hearth.loader.Integration;
import com.hearth.loader.IntegrationRoot;
import com.hearth.loader.manifest.ManifestStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads component modules by name from the custom namespace, then the
 * built-in one. Loaded modules are cached per host; misses are not.
 */
@Slf4j
public class ModuleLoader implements AutoCloseable {

    private final HostContext host;
    private final ModuleNamespace custom;
    private final ModuleNamespace builtin;

    private final Map<String, ComponentHandle> modules = new ConcurrentHashMap<>();
    private volatile boolean mounted;

    /**
     * @param custom  custom namespace, or null when there is no config dir
     * @param builtin built-in namespace
     */
    public ModuleLoader(HostContext host, ModuleNamespace custom, ModuleNamespace builtin) {
        this.host = host;
        this.custom = custom;
        this.builtin = builtin;
    }

    // =========================================================================
    // Lookup by name
    // =========================================================================

    /**
     * Load a component or platform module by name, e.g. {@code hue} or
     * {@code hue.light}. Custom modules shadow built-in ones except in safe mode.
     *
     * @return the module, or empty when no namespace has it or it failed to load
     */
    public Optional<ComponentHandle> loadFile(String name) {
        ComponentHandle cached = modules.get(name);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (!mounted) {
            if (!host.mountConfigDir()) {
                return Optional.empty();
            }
            mounted = true;
        }

        for (ModuleNamespace namespace : lookupPath()) {
            try {
                Optional<ComponentModule> module = namespace.find(name);
                if (module.isPresent()) {
                    ComponentHandle handle = new ComponentHandle(name, module.get(), host, namespace == builtin);
                    ComponentHandle existing = modules.putIfAbsent(name, handle);
                    return Optional.of(existing != null ? existing : handle);
                }
            } catch (ComponentImportException e) {
                log.error("Error loading {}.{}. Make sure all dependencies are installed", namespace.name(), name, e);
            }
        }
        return Optional.empty();
    }

    /**
     * Load a module from the built-in namespace only.
     *
     * @throws ComponentImportException if it does not exist or fails to load
     */
    public ComponentHandle loadBuiltin(String name) {
        return load(builtin, name, name);
    }

    // =========================================================================
    // Lookup by integration
    // =========================================================================

    /**
     * The integration's own module, loaded from the namespace of its root.
     *
     * @throws ComponentImportException if the module is missing or fails to load
     */
    public ComponentHandle getComponent(Integration integration) {
        return load(namespaceFor(integration), integration.getDomain(), integration.getDomain());
    }

    /**
     * A platform module of an integration, such as {@code hue.light}.
     *
     * @throws ComponentImportException if the module is missing or fails to load
     */
    public ComponentHandle getPlatform(Integration integration, String platform) {
        String fullName = integration.getDomain() + "." + platform;
        return load(namespaceFor(integration), fullName, fullName);
    }

    /**
     * Build an integration for a module that ships without a manifest, using
     * the dependencies and requirements the module declares.
     */
    public Optional<Integration> resolveLegacy(String domain) {
        return loadFile(domain).map(handle -> {
            ComponentModule module = handle.getModule();
            IntegrationRoot root = handle.isBuiltIn() ? host.getBuiltinRoot() : host.getCustomRoot();
            Path filePath = root.basePaths().isEmpty() ? null : root.basePaths().get(0).resolve(domain);
            return new Integration(root, filePath,
                    ManifestStore.legacy(domain, module.dependencies(), module.requirements()));
        });
    }

    // =========================================================================
    // Internals
    // =========================================================================

    private List<ModuleNamespace> lookupPath() {
        List<ModuleNamespace> path = new ArrayList<>(2);
        if (!host.isSafeMode() && custom != null) {
            path.add(custom);
        }
        path.add(builtin);
        return path;
    }

    private ModuleNamespace namespaceFor(Integration integration) {
        return integration.isBuiltIn() ? builtin : custom;
    }

    private ComponentHandle load(ModuleNamespace namespace, String cacheKey, String moduleName) {
        ComponentHandle cached = modules.get(cacheKey);
        if (cached != null) {
            return cached;
        }
        if (namespace == null) {
            throw new ComponentImportException(moduleName, "No namespace to load " + moduleName + " from");
        }
        String qualified = namespace.name() + "." + moduleName;
        ComponentModule module;
        try {
            module = namespace.find(moduleName).orElseThrow(() ->
                    new ComponentImportException(moduleName, "No module named " + qualified));
        } catch (ComponentImportException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ComponentImportException(moduleName, "Failed to load " + qualified, e);
        }
        ComponentHandle handle = new ComponentHandle(moduleName, module, host, namespace == builtin);
        ComponentHandle existing = modules.putIfAbsent(cacheKey, handle);
        return existing != null ? existing : handle;
    }

    @Override
    public void close() {
        if (custom != null) {
            custom.close();
        }
        builtin.close();
    }
}
