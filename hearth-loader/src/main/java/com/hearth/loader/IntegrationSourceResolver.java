package com.hearth.loader;

import com.hearth.common.version.VersionParseException;
import com.hearth.common.version.VersionParser;
import com.hearth.common.version.VersionStrategy;
import com.hearth.loader.manifest.ManifestStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Locates integration manifests under a root and turns them into
 * {@link Integration}s. Custom integrations must carry a parseable version.
 * All methods block on filesystem I/O.
 */
@Slf4j
public class IntegrationSourceResolver {

    static final List<VersionStrategy> CUSTOM_VERSION_STRATEGIES = List.of(
            VersionStrategy.CALVER,
            VersionStrategy.SEMVER,
            VersionStrategy.SIMPLEVER,
            VersionStrategy.BUILDVER,
            VersionStrategy.PEP440);

    private static final String VERSIONS_DOC = "https://developers.hearth.dev/docs/custom-integrations#versions";

    private final IntegrationFileSystem fileSystem;

    public IntegrationSourceResolver(IntegrationFileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    /**
     * Resolve one integration from a root.
     *
     * @return the integration, or null when no base path holds a usable
     *         manifest or a custom integration fails the version check
     * @throws IOException if a manifest exists but cannot be read
     */
    public Integration resolveFromRoot(IntegrationRoot root, String domain) throws IOException {
        for (Path base : root.basePaths()) {
            Path manifestPath = base.resolve(domain).resolve(ManifestStore.MANIFEST_FILENAME);
            if (!fileSystem.isFile(manifestPath)) {
                continue;
            }

            var result = ManifestStore.parse(fileSystem.readString(manifestPath), manifestPath);
            if (result instanceof ManifestStore.ManifestLoadResult.Failure failure) {
                log.error("Error parsing manifest.json file at {}: {}", manifestPath, failure.error());
                continue;
            }
            var manifest = ((ManifestStore.ManifestLoadResult.Success) result).manifest();
            Integration integration = new Integration(root, manifestPath.getParent(), manifest);

            if (integration.isBuiltIn()) {
                return integration;
            }

            log.warn("We found a custom integration {} which has not been tested by Hearth. "
                    + "This component might cause stability problems, be sure to disable it "
                    + "if you experience issues with Hearth", integration.getDomain());
            return passesVersionCheck(integration) ? integration : null;
        }
        return null;
    }

    /**
     * Resolve several integrations from a root. A domain that fails to
     * resolve is logged and left out of the result.
     */
    public Map<String, Integration> resolveIntegrationsFromRoot(IntegrationRoot root, List<String> domains) {
        Map<String, Integration> integrations = new LinkedHashMap<>();
        for (String domain : domains) {
            try {
                Integration integration = resolveFromRoot(root, domain);
                if (integration != null) {
                    integrations.put(domain, integration);
                }
            } catch (Exception e) {
                log.error("Error loading integration: {}", domain, e);
            }
        }
        return integrations;
    }

    private boolean passesVersionCheck(Integration integration) {
        String version = integration.getVersion();
        if (version == null) {
            log.error("The custom integration '{}' does not have a version key in the manifest file "
                    + "and was blocked from loading. See {} for more details",
                    integration.getDomain(), VERSIONS_DOC);
            return false;
        }
        try {
            VersionParser.parse(version, CUSTOM_VERSION_STRATEGIES);
            return true;
        } catch (VersionParseException e) {
            log.error("The custom integration '{}' does not have a valid version key ({}) in the manifest "
                    + "file and was blocked from loading. See {} for more details",
                    integration.getDomain(), version, VERSIONS_DOC);
            return false;
        }
    }
}
