package com.hearth.loader.module;

import com.hearth.loader.ComponentImportException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Module namespace backed by {@link ServiceLoader}.
 * <p>
 * A directory namespace builds its class loader on first lookup from the
 * jars in the directory and in its immediate sub directories, and only
 * answers with modules defined by those jars. A missing directory is
 * checked again on every lookup until it exists.
 */
@Slf4j
public class ServiceLoaderNamespace implements ModuleNamespace {

    private final String name;
    private final Path directory;
    private final ClassLoader parent;

    private ClassLoader classLoader;
    private URLClassLoader ownedLoader;
    private Map<String, ServiceLoader.Provider<ComponentModule>> index;

    private ServiceLoaderNamespace(String name, Path directory, ClassLoader classLoader, ClassLoader parent) {
        this.name = name;
        this.directory = directory;
        this.classLoader = classLoader;
        this.parent = parent;
    }

    /**
     * Namespace over every module visible to a class loader.
     */
    public static ServiceLoaderNamespace forClassLoader(String name, ClassLoader classLoader) {
        return new ServiceLoaderNamespace(name, null, classLoader, null);
    }

    /**
     * Namespace over the modules packaged in jars under a directory.
     */
    public static ServiceLoaderNamespace forDirectory(String name, Path directory, ClassLoader parent) {
        return new ServiceLoaderNamespace(name, directory, null, parent);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<ComponentModule> find(String moduleName) {
        ServiceLoader.Provider<ComponentModule> provider = index().get(moduleName);
        if (provider == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(provider.get());
        } catch (ServiceConfigurationError e) {
            throw new ComponentImportException(moduleName,
                    "Failed to instantiate " + name + "." + moduleName, unwrap(e));
        }
    }

    private synchronized Map<String, ServiceLoader.Provider<ComponentModule>> index() {
        if (index != null) {
            return index;
        }
        ClassLoader loader = classLoader();
        if (loader == null) {
            // directory not created yet; look again on the next lookup
            return Map.of();
        }
        Map<String, ServiceLoader.Provider<ComponentModule>> built = new HashMap<>();
        try {
            ServiceLoader.load(ComponentModule.class, loader).stream().forEach(provider -> {
                Class<? extends ComponentModule> type = provider.type();
                if (directory != null && type.getClassLoader() != loader) {
                    return;
                }
                ModuleName moduleName = type.getAnnotation(ModuleName.class);
                if (moduleName == null) {
                    log.warn("Component module {} has no @ModuleName and is ignored", type.getName());
                    return;
                }
                if (built.putIfAbsent(moduleName.value(), provider) != null) {
                    log.warn("Duplicate component module {} in {}, keeping the first", moduleName.value(), name);
                }
            });
        } catch (ServiceConfigurationError e) {
            throw new ComponentImportException(name, "Failed to list component modules in " + name, unwrap(e));
        }
        index = built;
        return index;
    }

    private ClassLoader classLoader() {
        if (classLoader != null || directory == null) {
            return classLoader;
        }
        if (!Files.isDirectory(directory)) {
            return null;
        }
        try {
            List<URL> urls = new ArrayList<>();
            addJars(directory, urls);
            try (Stream<Path> children = Files.list(directory)) {
                for (Path child : children.filter(Files::isDirectory).sorted().toList()) {
                    addJars(child, urls);
                }
            }
            ownedLoader = new URLClassLoader(urls.toArray(URL[]::new), parent);
            classLoader = ownedLoader;
            log.debug("Built class loader for {} with {} jar(s)", name, urls.size());
            return classLoader;
        } catch (IOException e) {
            throw new ComponentImportException(name, "Failed to read " + directory, e);
        }
    }

    private static void addJars(Path dir, List<URL> urls) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            for (Path jar : files.filter(p -> p.toString().endsWith(".jar")).sorted().toList()) {
                urls.add(jar.toUri().toURL());
            }
        }
    }

    private static Throwable unwrap(ServiceConfigurationError e) {
        return e.getCause() != null ? e.getCause() : e;
    }

    @Override
    public synchronized void close() {
        if (ownedLoader == null) {
            return;
        }
        try {
            ownedLoader.close();
        } catch (IOException e) {
            log.warn("Failed to close class loader for {}: {}", name, e.getMessage());
        }
        ownedLoader = null;
    }
}
