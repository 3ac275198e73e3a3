package com.hearth.loader.module;

import com.hearth.loader.HostContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A loaded component module bound to its host.
 * <p>
 * The capability table is built on first access; host-bound functions are
 * exposed as plain functions with the host already applied.
 */
public class ComponentHandle {

    private final String name;
    private final ComponentModule module;
    private final HostContext host;
    private final boolean builtIn;

    private volatile Map<String, ComponentFunction> capabilities;

    public ComponentHandle(String name, ComponentModule module, HostContext host, boolean builtIn) {
        this.name = name;
        this.module = module;
        this.host = host;
        this.builtIn = builtIn;
    }

    public String getName() {
        return name;
    }

    public ComponentModule getModule() {
        return module;
    }

    /** Whether the module came from the built-in namespace. */
    public boolean isBuiltIn() {
        return builtIn;
    }

    public Set<String> capabilityNames() {
        return capabilities().keySet();
    }

    public Optional<ComponentFunction> findCapability(String capability) {
        return Optional.ofNullable(capabilities().get(capability));
    }

    /**
     * @throws IllegalArgumentException if the module declares no such capability
     */
    public ComponentFunction capability(String capability) {
        return findCapability(capability).orElseThrow(() -> new IllegalArgumentException(
                "Module " + name + " has no capability " + capability));
    }

    public Object call(String capability, Object... args) {
        return capability(capability).apply(args);
    }

    private Map<String, ComponentFunction> capabilities() {
        Map<String, ComponentFunction> table = capabilities;
        if (table == null) {
            synchronized (this) {
                table = capabilities;
                if (table == null) {
                    table = buildCapabilities();
                    capabilities = table;
                }
            }
        }
        return table;
    }

    private Map<String, ComponentFunction> buildCapabilities() {
        Map<String, ComponentFunction> table = new LinkedHashMap<>();
        module.declare(new CapabilityRegistrar() {
            @Override
            public void function(String capability, ComponentFunction function) {
                table.put(capability, function);
            }

            @Override
            public void hostBound(String capability, HostBoundFunction function) {
                table.put(capability, args -> function.apply(host, args));
            }
        });
        return Collections.unmodifiableMap(table);
    }

    @Override
    public String toString() {
        return "<ComponentHandle " + name + ">";
    }
}
