package com.hearth.loader;

import com.hearth.loader.manifest.IntegrationType;
import com.hearth.loader.manifest.Manifest;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An integration resolved from a root: its manifest, where it lives, and
 * its transitive dependency closure once resolved.
 */
@Slf4j
public class Integration {

    private final IntegrationRoot root;
    private final String pkgPath;
    private final Path filePath;
    private final Manifest manifest;

    // null until resolution ran; then true or false, never changed again
    private volatile Boolean allDependenciesResolved;
    private volatile Set<String> allDependencies;

    public Integration(IntegrationRoot root, Path filePath, Manifest manifest) {
        this.root = root;
        this.pkgPath = root.packagePath(manifest.getDomain());
        this.filePath = filePath;
        this.manifest = manifest;

        if (manifest.getDependencies().isEmpty()) {
            this.allDependenciesResolved = true;
            this.allDependencies = Set.of();
        }

        log.info("Loaded {} from {}", getDomain(), pkgPath);
    }

    public String getDomain() {
        return manifest.getDomain();
    }

    public String getName() {
        return manifest.getName();
    }

    /** Reason the integration is disabled, or null. */
    public String getDisabled() {
        return manifest.getDisabled();
    }

    public List<String> getDependencies() {
        return manifest.getDependencies();
    }

    public List<String> getAfterDependencies() {
        return manifest.getAfterDependencies();
    }

    public List<String> getRequirements() {
        return manifest.getRequirements();
    }

    public boolean isConfigFlow() {
        return manifest.isConfigFlow();
    }

    public IntegrationType getIntegrationType() {
        return manifest.getIntegrationType();
    }

    public String getDocumentation() {
        return manifest.getDocumentation();
    }

    public String getIssueTracker() {
        return manifest.getIssueTracker();
    }

    public String getQualityScale() {
        return manifest.getQualityScale();
    }

    public String getIotClass() {
        return manifest.getIotClass();
    }

    public List<String> getLoggers() {
        return manifest.getLoggers();
    }

    /** Raw version string, or null when the manifest has none. */
    public String getVersion() {
        return manifest.getVersion();
    }

    public List<Object> getZeroconf() {
        return manifest.getZeroconf();
    }

    public List<Map<String, Object>> getSsdp() {
        return manifest.getSsdp();
    }

    public List<Map<String, Object>> getBluetooth() {
        return manifest.getBluetooth();
    }

    public List<Map<String, Object>> getDhcp() {
        return manifest.getDhcp();
    }

    public List<Map<String, Object>> getUsb() {
        return manifest.getUsb();
    }

    public Map<String, List<String>> getHomekit() {
        return manifest.getHomekit();
    }

    public List<String> getMqtt() {
        return manifest.getMqtt();
    }

    public Manifest getManifest() {
        return manifest;
    }

    public IntegrationRoot getRoot() {
        return root;
    }

    public String getPkgPath() {
        return pkgPath;
    }

    public Path getFilePath() {
        return filePath;
    }

    public boolean isBuiltIn() {
        return root.builtIn();
    }

    /**
     * All dependencies including sub-dependencies, excluding this integration.
     *
     * @throws IllegalStateException if dependencies have not been resolved
     */
    public Set<String> getAllDependencies() {
        Set<String> deps = allDependencies;
        if (deps == null) {
            throw new IllegalStateException("Dependencies not resolved!");
        }
        return deps;
    }

    /** Whether dependency resolution has run, successfully or not. */
    public boolean isAllDependenciesResolved() {
        return allDependenciesResolved != null;
    }

    /** Outcome of dependency resolution, or null before it ran. */
    Boolean dependencyResolutionOutcome() {
        return allDependenciesResolved;
    }

    void markDependenciesResolved(Set<String> dependencies) {
        this.allDependencies = Set.copyOf(dependencies);
        this.allDependenciesResolved = true;
    }

    void markDependenciesFailed() {
        this.allDependenciesResolved = false;
    }

    @Override
    public String toString() {
        return "<Integration " + getDomain() + ": " + pkgPath + ">";
    }
}
