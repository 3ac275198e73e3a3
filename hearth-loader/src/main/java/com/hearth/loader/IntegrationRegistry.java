package com.hearth.loader;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of resolved integrations keyed by domain.
 * <p>
 * The cache is only written from the loop thread. Concurrent requests for a
 * domain that is not yet resolved share one pending marker, so each domain
 * is probed at most once at a time. Failed lookups are not cached and are
 * retried on the next request.
 */
@Slf4j
public class IntegrationRegistry {

    // =========================================================================
    // Cache entries
    // =========================================================================

    sealed interface CacheEntry {
        record Pending(CompletableFuture<Void> signal) implements CacheEntry {
        }

        record Resolved(Integration integration) implements CacheEntry {
        }
    }

    private final HostContext host;
    private final IntegrationSourceResolver sourceResolver;

    // null until the config dir was mounted; concurrent so facades can peek
    private volatile Map<String, CacheEntry> cache;
    private CompletableFuture<Map<String, Integration>> customIntegrations;

    IntegrationRegistry(HostContext host, IntegrationSourceResolver sourceResolver) {
        this.host = host;
        this.sourceResolver = sourceResolver;
    }

    // =========================================================================
    // Lookups
    // =========================================================================

    /**
     * Get an integration, loading it on first use.
     * <p>
     * Completes exceptionally with {@link IntegrationNotFoundException} or
     * {@link InvalidDomainException} when the domain cannot be resolved.
     */
    public CompletableFuture<Integration> getIntegration(String domain) {
        return getIntegrations(List.of(domain)).thenApply(results -> results.get(domain).orThrow());
    }

    /**
     * Get several integrations. The result holds one entry per distinct
     * requested domain, in request order, and never completes exceptionally
     * because of a single domain.
     */
    public CompletableFuture<Map<String, IntegrationResult>> getIntegrations(Collection<String> domains) {
        List<String> requested = List.copyOf(new LinkedHashSet<>(domains));
        return host.runOnLoop(() -> lookup(requested));
    }

    /**
     * Peek at the cache without loading anything.
     */
    public Optional<Integration> getCachedIntegration(String domain) {
        Map<String, CacheEntry> current = cache;
        if (current == null) {
            return Optional.empty();
        }
        CacheEntry entry = current.get(domain);
        if (entry instanceof CacheEntry.Resolved resolved) {
            return Optional.of(resolved.integration());
        }
        return Optional.empty();
    }

    /**
     * All custom integrations keyed by domain. Enumerated once per host and
     * shared by every caller; empty in safe mode or without a config dir.
     */
    public CompletableFuture<Map<String, Integration>> getCustomIntegrations() {
        return host.runOnLoop(() -> {
            if (customIntegrations == null) {
                customIntegrations = scanCustomIntegrations();
            }
            return customIntegrations;
        });
    }

    // =========================================================================
    // Loop-thread internals
    // =========================================================================

    private CompletableFuture<Map<String, IntegrationResult>> lookup(List<String> domains) {
        Map<String, IntegrationResult> results = new LinkedHashMap<>();
        if (cache == null) {
            if (!host.mountConfigDir()) {
                for (String domain : domains) {
                    results.put(domain, notFound(domain, null));
                }
                return CompletableFuture.completedFuture(results);
            }
            cache = new ConcurrentHashMap<>();
        }

        Map<String, CacheEntry.Pending> inProgress = new LinkedHashMap<>();
        Map<String, CacheEntry.Pending> needed = new LinkedHashMap<>();
        for (String domain : domains) {
            CacheEntry entry = cache.get(domain);
            if (entry instanceof CacheEntry.Resolved resolved) {
                results.put(domain, new IntegrationResult.Found(resolved.integration()));
            } else if (entry instanceof CacheEntry.Pending pending) {
                inProgress.put(domain, pending);
            } else if (domain.contains(".")) {
                results.put(domain, new IntegrationResult.Failed(new InvalidDomainException(domain)));
            } else {
                CacheEntry.Pending pending = new CacheEntry.Pending(new CompletableFuture<>());
                cache.put(domain, pending);
                needed.put(domain, pending);
            }
        }

        CompletableFuture<Void> waited = awaitInProgress(inProgress, results);
        CompletableFuture<Void> loaded = needed.isEmpty()
                ? CompletableFuture.completedFuture(null)
                : loadNeeded(needed, results);
        return CompletableFuture.allOf(waited, loaded).thenApply(ignored -> ordered(domains, results));
    }

    private CompletableFuture<Void> awaitInProgress(Map<String, CacheEntry.Pending> inProgress,
            Map<String, IntegrationResult> results) {
        if (inProgress.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<?>[] signals = inProgress.values().stream()
                .map(CacheEntry.Pending::signal)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(signals).thenRun(() -> {
            for (String domain : inProgress.keySet()) {
                // the other load failed if the domain is still not cached
                results.put(domain, getCachedIntegration(domain)
                        .<IntegrationResult>map(IntegrationResult.Found::new)
                        .orElseGet(() -> notFound(domain, null)));
            }
        });
    }

    private CompletableFuture<Void> loadNeeded(Map<String, CacheEntry.Pending> needed,
            Map<String, IntegrationResult> results) {
        return getCustomIntegrations()
                .thenCompose(custom -> {
                    Map<String, CacheEntry.Pending> remaining = new LinkedHashMap<>();
                    needed.forEach((domain, pending) -> {
                        Integration integration = custom.get(domain);
                        if (integration != null) {
                            commit(domain, pending, integration, null, results);
                        } else {
                            remaining.put(domain, pending);
                        }
                    });

                    IntegrationRoot builtinRoot = host.getBuiltinRoot();
                    List<CompletableFuture<Void>> jobs = new ArrayList<>();
                    remaining.forEach((domain, pending) -> jobs.add(
                            host.addExecutorJob(() -> sourceResolver.resolveFromRoot(builtinRoot, domain))
                                    .handle((integration, error) -> {
                                        commit(domain, pending, integration, error, results);
                                        return null;
                                    })));
                    return CompletableFuture.allOf(jobs.toArray(new CompletableFuture[0]));
                })
                .handle((ignored, error) -> {
                    // release anything a failure above left pending
                    needed.forEach((domain, pending) -> {
                        if (!pending.signal().isDone()) {
                            commit(domain, pending, null, error, results);
                        }
                    });
                    return null;
                });
    }

    private void commit(String domain, CacheEntry.Pending pending, Integration integration, Throwable error,
            Map<String, IntegrationResult> results) {
        if (integration != null) {
            cache.put(domain, new CacheEntry.Resolved(integration));
            results.put(domain, new IntegrationResult.Found(integration));
        } else {
            cache.remove(domain, pending);
            Throwable cause = error == null ? null : HostContext.unwrap(error);
            if (cause != null) {
                log.error("Error loading integration: {}", domain, cause);
            }
            results.put(domain, notFound(domain, cause));
        }
        pending.signal().complete(null);
    }

    private CompletableFuture<Map<String, Integration>> scanCustomIntegrations() {
        IntegrationRoot root = host.getCustomRoot();
        if (host.isSafeMode() || root == null) {
            return CompletableFuture.completedFuture(Map.of());
        }
        IntegrationFileSystem fileSystem = host.getFileSystem();
        return host.addExecutorJob(() -> {
                    List<String> names = new ArrayList<>();
                    for (Path base : root.basePaths()) {
                        if (!fileSystem.isDirectory(base)) {
                            continue;
                        }
                        for (Path dir : fileSystem.listSubdirectories(base)) {
                            String name = dir.getFileName().toString();
                            if (!name.startsWith(".") && !name.startsWith("_")) {
                                names.add(name);
                            }
                        }
                    }
                    return sourceResolver.resolveIntegrationsFromRoot(root, names);
                })
                .thenApply(resolved -> {
                    Map<String, Integration> byDomain = new LinkedHashMap<>();
                    for (Integration integration : resolved.values()) {
                        byDomain.put(integration.getDomain(), integration);
                    }
                    return Collections.unmodifiableMap(byDomain);
                })
                .exceptionally(error -> {
                    log.error("Error listing custom integrations in {}", root.basePaths(),
                            HostContext.unwrap(error));
                    return Map.of();
                });
    }

    private static IntegrationResult notFound(String domain, Throwable cause) {
        IntegrationNotFoundException error = cause == null
                ? new IntegrationNotFoundException(domain)
                : new IntegrationNotFoundException(domain, cause);
        return new IntegrationResult.Failed(error);
    }

    private static Map<String, IntegrationResult> ordered(List<String> domains,
            Map<String, IntegrationResult> results) {
        Map<String, IntegrationResult> ordered = new LinkedHashMap<>();
        for (String domain : domains) {
            ordered.put(domain, results.get(domain));
        }
        return ordered;
    }
}
