package com.hearth.loader;

import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Iterator;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Computes the transitive dependency closure of an integration, failing on
 * hard dependency cycles and on soft dependencies that point back at the
 * integration being resolved.
 */
@Slf4j
public class DependencyResolver {

    private final HostContext host;
    private final IntegrationRegistry registry;

    DependencyResolver(HostContext host, IntegrationRegistry registry) {
        this.host = host;
        this.registry = registry;
    }

    /**
     * Resolve all dependencies of an integration and remember the outcome on it.
     *
     * @return true when the closure was computed; false, after logging the
     *         reason, when a dependency is missing or cyclic. Never completes
     *         exceptionally.
     */
    public CompletableFuture<Boolean> resolve(Integration integration) {
        return host.runOnLoop(() -> {
            Boolean outcome = integration.dependencyResolutionOutcome();
            if (outcome != null) {
                return CompletableFuture.completedFuture(outcome);
            }
            String domain = integration.getDomain();
            return componentDependencies(integration).handle((closure, error) -> {
                if (error == null) {
                    integration.markDependenciesResolved(closure);
                    return true;
                }
                logFailure(domain, HostContext.unwrap(error));
                integration.markDependenciesFailed();
                return false;
            });
        });
    }

    /**
     * Compute the dependency closure without recording it.
     * <p>
     * Completes exceptionally with {@link IntegrationNotFoundException} for
     * the first dependency that cannot be loaded, or with
     * {@link CircularDependencyException} naming the edge that closes a cycle.
     */
    public CompletableFuture<Set<String>> componentDependencies(Integration integration) {
        String start = integration.getDomain();
        Set<String> loaded = new HashSet<>();
        Set<String> loading = new HashSet<>();
        return host.runOnLoop(() -> visit(start, integration, loaded, loading).thenApply(ignored -> {
            Set<String> closure = new HashSet<>(loaded);
            closure.remove(start);
            return closure;
        }));
    }

    // =========================================================================
    // Depth-first traversal
    // =========================================================================

    private CompletableFuture<Void> visit(String start, Integration current, Set<String> loaded,
            Set<String> loading) {
        String domain = current.getDomain();
        loading.add(domain);
        Iterator<String> dependencies = current.getDependencies().iterator();
        return visitNext(start, domain, dependencies, loaded, loading).thenRun(() -> {
            loaded.add(domain);
            loading.remove(domain);
        });
    }

    private CompletableFuture<Void> visitNext(String start, String domain, Iterator<String> dependencies,
            Set<String> loaded, Set<String> loading) {
        while (dependencies.hasNext()) {
            String dependency = dependencies.next();
            if (loaded.contains(dependency)) {
                continue;
            }
            if (loading.contains(dependency)) {
                return CompletableFuture.failedFuture(new CircularDependencyException(domain, dependency));
            }
            loaded.add(dependency);

            return registry.getIntegration(dependency)
                    .exceptionally(error -> {
                        throw new IntegrationNotFoundException(dependency, HostContext.unwrap(error));
                    })
                    .thenCompose(child -> {
                        if (child.getAfterDependencies().contains(start)) {
                            throw new CircularDependencyException(start, dependency);
                        }
                        CompletableFuture<Void> descent = child.getDependencies().isEmpty()
                                ? CompletableFuture.completedFuture(null)
                                : visit(start, child, loaded, loading);
                        return descent.thenCompose(ignored -> visitNext(start, domain, dependencies, loaded, loading));
                    });
        }
        return CompletableFuture.completedFuture(null);
    }

    private static void logFailure(String domain, Throwable cause) {
        if (cause instanceof IntegrationNotFoundException notFound) {
            log.error("Unable to resolve dependencies for {}: we are unable to resolve (sub)dependency {}",
                    domain, notFound.getDomain());
        } else if (cause instanceof CircularDependencyException circular) {
            log.error("Unable to resolve dependencies for {}: it contains a circular dependency: {} -> {}",
                    domain, circular.getFromDomain(), circular.getToDomain());
        } else {
            log.error("Unable to resolve dependencies for {}", domain, cause);
        }
    }
}
