package com.hearth.loader;

import com.hearth.loader.discovery.DiscoveryAggregator;
import com.hearth.loader.module.Components;
import com.hearth.loader.module.Helpers;
import com.hearth.loader.module.ModuleLoader;
import com.hearth.loader.module.ModuleNamespace;
import com.hearth.loader.module.ServiceLoaderNamespace;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * The host process as seen by the loader. Owns the loader settings, the
 * single loop thread that all cache mutation happens on, the bounded worker
 * pool for blocking I/O, and the registry with its collaborators.
 */
@Slf4j
public class HostContext implements AutoCloseable {

    private static final String LOOP_THREAD_NAME = "hearth-loop";

    private final LoaderSettings settings;
    private final IntegrationFileSystem fileSystem;
    private final IntegrationRoot builtinRoot;
    private final IntegrationRoot customRoot;
    private final ExecutorService loop;
    private final ExecutorService workers;
    private volatile Thread loopThread;

    private final IntegrationRegistry registry;
    private final DependencyResolver dependencyResolver;
    private final DiscoveryAggregator discovery;
    private final ModuleLoader moduleLoader;
    private final Components components;
    private final Helpers helpers;

    @Builder
    private HostContext(LoaderSettings settings, IntegrationFileSystem fileSystem,
            ModuleNamespace customNamespace, ModuleNamespace builtinNamespace) {
        this.settings = settings != null ? settings : new LoaderSettings();
        this.fileSystem = fileSystem != null ? fileSystem : new LocalIntegrationFileSystem();

        this.builtinRoot = IntegrationRoot.builtin(BuiltinIntegrationsDir.resolve(this.settings.getBuiltinDir()));
        Path customDir = this.settings.customRoot();
        this.customRoot = customDir != null ? IntegrationRoot.custom(customDir) : null;

        this.loop = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, LOOP_THREAD_NAME);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
        AtomicInteger workerIds = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, this.settings.getMaxLoadConcurrently()), runnable -> {
            Thread thread = new Thread(runnable, "hearth-loader-" + workerIds.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        this.registry = new IntegrationRegistry(this, new IntegrationSourceResolver(this.fileSystem));
        this.dependencyResolver = new DependencyResolver(this, registry);
        this.discovery = new DiscoveryAggregator(this, registry);

        ModuleNamespace builtin = builtinNamespace != null ? builtinNamespace
                : ServiceLoaderNamespace.forClassLoader(IntegrationRoot.PACKAGE_BUILTIN,
                        HostContext.class.getClassLoader());
        ModuleNamespace custom = customNamespace;
        if (custom == null && customDir != null) {
            custom = ServiceLoaderNamespace.forDirectory(IntegrationRoot.PACKAGE_CUSTOM, customDir,
                    HostContext.class.getClassLoader());
        }
        this.moduleLoader = new ModuleLoader(this, custom, builtin);
        this.components = new Components(registry, moduleLoader);
        this.helpers = new Helpers(moduleLoader);
    }

    public static HostContext create(LoaderSettings settings) {
        return builder().settings(settings).build();
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public LoaderSettings getSettings() {
        return settings;
    }

    public IntegrationRegistry getRegistry() {
        return registry;
    }

    public DependencyResolver getDependencyResolver() {
        return dependencyResolver;
    }

    public DiscoveryAggregator getDiscovery() {
        return discovery;
    }

    public ModuleLoader getModuleLoader() {
        return moduleLoader;
    }

    public Components getComponents() {
        return components;
    }

    public Helpers getHelpers() {
        return helpers;
    }

    public IntegrationRoot getBuiltinRoot() {
        return builtinRoot;
    }

    /** Custom root, or null when there is no config directory. */
    public IntegrationRoot getCustomRoot() {
        return customRoot;
    }

    public boolean isSafeMode() {
        return settings.isSafeMode();
    }

    IntegrationFileSystem getFileSystem() {
        return fileSystem;
    }

    // =========================================================================
    // Scheduling
    // =========================================================================

    /**
     * Whether the calling thread is the loop thread.
     */
    public boolean isLoopThread() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Run a task on the loop thread. The task runs inline when already on it.
     */
    public <T> CompletableFuture<T> runOnLoop(Supplier<CompletableFuture<T>> task) {
        if (isLoopThread()) {
            try {
                return task.get();
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        try {
            return CompletableFuture.supplyAsync(task, loop).thenCompose(Function.identity());
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Run a blocking job on the worker pool. The returned future completes
     * on the loop thread, so callers may commit the result to shared state
     * from its dependent stages.
     */
    public <T> CompletableFuture<T> addExecutorJob(Callable<T> job) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            CompletableFuture.supplyAsync(() -> {
                try {
                    return job.call();
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, workers).whenComplete((value, error) -> {
                try {
                    loop.execute(() -> {
                        if (error != null) {
                            result.completeExceptionally(unwrap(error));
                        } else {
                            result.complete(value);
                        }
                    });
                } catch (RejectedExecutionException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Check that a config directory is available for loading integrations.
     */
    public boolean mountConfigDir() {
        if (settings.getConfigDir() == null) {
            log.error("Can't load integrations - configuration directory is not set");
            return false;
        }
        return true;
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        workers.shutdown();
        loop.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
        moduleLoader.close();
        log.debug("Host context closed");
    }
}
