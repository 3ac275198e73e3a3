package com.hearth.loader.module;

import com.hearth.loader.ComponentImportException;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Access to built-in helper modules, named {@code helpers.<name>}.
 */
public class Helpers {

    public static final String PREFIX = "helpers.";

    private final ModuleLoader moduleLoader;
    private final Map<String, ComponentHandle> helpers = new ConcurrentHashMap<>();

    public Helpers(ModuleLoader moduleLoader) {
        this.moduleLoader = moduleLoader;
    }

    /**
     * @throws ComponentImportException if the helper does not exist
     */
    public ComponentHandle get(String name) {
        return helpers.computeIfAbsent(name, n -> moduleLoader.loadBuiltin(PREFIX + n));
    }
}
