package com.hearth.app.config;

import com.hearth.common.config.ConfigService;
import com.hearth.loader.HostContext;
import com.hearth.loader.Integration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LoaderBootstrapTest {

    @TempDir
    Path tempDir;

    LoaderBootstrap bootstrap;

    @AfterEach
    void tearDown() {
        if (bootstrap != null) {
            bootstrap.shutdown();
        }
    }

    private void writeManifest(Path root, String domain, String json) throws IOException {
        Files.writeString(Files.createDirectories(root.resolve(domain)).resolve("manifest.json"), json);
    }

    private void writeConfig(Path builtinDir, String integrations) throws IOException {
        Files.writeString(tempDir.resolve("hearth.json"), """
                {
                  "integrations": %s,
                  "loader": { "builtinDir": "%s" }
                }
                """.formatted(integrations, builtinDir.toString().replace("\\", "\\\\")));
    }

    @Test
    void loadsConfiguredIntegrationsAndResolvesDependencies() throws IOException {
        Path builtinDir = Files.createDirectories(tempDir.resolve("builtin"));
        writeManifest(builtinDir, "light", "{\"domain\": \"light\", \"dependencies\": [\"group\"]}");
        writeManifest(builtinDir, "group", "{\"domain\": \"group\"}");
        writeConfig(builtinDir, "[\"light\", \"missing\"]");

        bootstrap = new LoaderBootstrap(new ConfigService(tempDir));
        bootstrap.init();

        HostContext host = bootstrap.getHostContext();
        assertNotNull(host);
        Integration light = host.getRegistry().getCachedIntegration("light").orElseThrow();
        assertEquals(Set.of("group"), light.getAllDependencies());
        assertTrue(host.getRegistry().getCachedIntegration("missing").isEmpty());
    }

    @Test
    void startsWithoutConfigFile() {
        bootstrap = new LoaderBootstrap(new ConfigService(tempDir.resolve("nowhere")));

        assertDoesNotThrow(bootstrap::init);
        assertNotNull(bootstrap.getHostContext());
    }
}
