package com.hearth.loader;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IntegrationRegistryTest {

    @TempDir
    Path tempDir;

    Path configDir;
    Path builtinDir;
    Path customDir;
    CountingFileSystem fileSystem;
    HostContext host;

    @BeforeEach
    void setUp() throws IOException {
        configDir = Files.createDirectories(tempDir.resolve("config"));
        customDir = Files.createDirectories(configDir.resolve("custom_integrations"));
        builtinDir = Files.createDirectories(tempDir.resolve("builtin"));
        fileSystem = new CountingFileSystem();
    }

    @AfterEach
    void tearDown() {
        if (host != null) {
            host.close();
        }
    }

    private IntegrationRegistry registry(LoaderSettings.LoaderSettingsBuilder settings) {
        host = HostContext.builder().settings(settings.build()).fileSystem(fileSystem).build();
        return host.getRegistry();
    }

    private IntegrationRegistry registry() {
        return registry(LoaderSettings.builder().configDir(configDir).builtinDir(builtinDir));
    }

    @Test
    void loadsBuiltinIntegration() throws IOException {
        Manifests.write(builtinDir, "sun", "{\"domain\": \"sun\", \"name\": \"Sun\"}");

        Integration sun = registry().getIntegration("sun").join();

        assertEquals("Sun", sun.getName());
        assertTrue(sun.isBuiltIn());
    }

    @Test
    void cachedIntegrationReturnedWithoutIo() throws IOException {
        Manifests.write(builtinDir, "sun", "{\"domain\": \"sun\"}");
        IntegrationRegistry registry = registry();

        Integration first = registry.getIntegration("sun").join();
        int calls = fileSystem.totalCalls();
        Integration second = registry.getIntegration("sun").join();

        assertSame(first, second);
        assertEquals(calls, fileSystem.totalCalls());
        assertEquals(first, registry.getCachedIntegration("sun").orElseThrow());
    }

    @Nested
    class Failures {

        @Test
        void missingIntegrationIsNotFound() {
            IntegrationRegistry registry = registry();

            Map<String, IntegrationResult> results = registry.getIntegrations(List.of("nope")).join();

            var failed = assertInstanceOf(IntegrationResult.Failed.class, results.get("nope"));
            var error = assertInstanceOf(IntegrationNotFoundException.class, failed.error());
            assertEquals("nope", error.getDomain());
            assertEquals("Integration 'nope' not found.", error.getMessage());
        }

        @Test
        void getIntegrationCompletesExceptionally() {
            CompletionException thrown = assertThrows(CompletionException.class,
                    () -> registry().getIntegration("nope").join());

            assertInstanceOf(IntegrationNotFoundException.class, thrown.getCause());
        }

        @Test
        void dottedDomainRejectedWithoutTouchingFilesystem() {
            IntegrationRegistry registry = registry();

            Map<String, IntegrationResult> results = registry.getIntegrations(List.of("hue.light")).join();

            var failed = assertInstanceOf(IntegrationResult.Failed.class, results.get("hue.light"));
            assertInstanceOf(InvalidDomainException.class, failed.error());
            assertEquals("Invalid domain hue.light", failed.error().getMessage());
            assertEquals(0, fileSystem.totalCalls());
            assertTrue(registry.getCachedIntegration("hue.light").isEmpty());
        }

        @Test
        void negativeResultIsNotCached() throws IOException {
            IntegrationRegistry registry = registry();
            assertFalse(registry.getIntegrations(List.of("later")).join().get("later").isFound());

            Manifests.write(builtinDir, "later", "{\"domain\": \"later\"}");

            assertEquals("later", registry.getIntegration("later").join().getDomain());
        }

        @Test
        void readErrorAttachedAsCause() throws IOException {
            Path manifest = Manifests.write(builtinDir, "broken", "{\"domain\": \"broken\"}");
            IOException diskError = new IOException("disk on fire");
            fileSystem.failOn(manifest, diskError);
            IntegrationRegistry registry = registry();

            try (LogCapture logs = LogCapture.of(IntegrationRegistry.class)) {
                var failed = (IntegrationResult.Failed) registry.getIntegrations(List.of("broken")).join().get("broken");

                assertInstanceOf(IntegrationNotFoundException.class, failed.error());
                assertSame(diskError, failed.error().getCause());
                assertTrue(logs.contains(Level.ERROR, "Error loading integration: broken"));
            }
            assertTrue(registry.getCachedIntegration("broken").isEmpty());
        }

        @Test
        void concurrentRequestsShareOneFailure() throws Exception {
            Path manifest = Manifests.write(builtinDir, "slow", "{\"domain\": \"slow\"}");
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            fileSystem.gate(manifest, entered, release);
            fileSystem.failOn(manifest, new IOException("device busy"));
            IntegrationRegistry registry = registry();

            CompletableFuture<Map<String, IntegrationResult>> first = registry.getIntegrations(List.of("slow"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            CompletableFuture<Map<String, IntegrationResult>> second = registry.getIntegrations(List.of("slow"));
            release.countDown();

            for (var results : List.of(first.get(5, TimeUnit.SECONDS), second.get(5, TimeUnit.SECONDS))) {
                var failed = assertInstanceOf(IntegrationResult.Failed.class, results.get("slow"));
                assertInstanceOf(IntegrationNotFoundException.class, failed.error());
                assertEquals("Integration 'slow' not found.", failed.error().getMessage());
            }
            assertEquals(1, fileSystem.reads(manifest));
            assertTrue(registry.getCachedIntegration("slow").isEmpty());

            fileSystem.clearFailure(manifest);

            assertEquals("slow", registry.getIntegration("slow").get(5, TimeUnit.SECONDS).getDomain());
            assertEquals(2, fileSystem.reads(manifest));
        }

        @Test
        void missingConfigDirMakesEverythingNotFound() throws IOException {
            Manifests.write(builtinDir, "sun", "{\"domain\": \"sun\"}");

            try (LogCapture logs = LogCapture.of(HostContext.class)) {
                IntegrationRegistry registry = registry(LoaderSettings.builder().builtinDir(builtinDir));
                Map<String, IntegrationResult> results = registry.getIntegrations(List.of("sun", "moon")).join();

                assertFalse(results.get("sun").isFound());
                assertFalse(results.get("moon").isFound());
                assertTrue(logs.contains(Level.ERROR, "Can't load integrations - configuration directory is not set"));
            }
            assertEquals(0, fileSystem.totalCalls());
        }
    }

    @Nested
    class Roots {

        @Test
        void customShadowsBuiltin() throws IOException {
            Manifests.write(builtinDir, "hue", "{\"domain\": \"hue\"}");
            Manifests.writeCustom(customDir, "hue", "1.0.0");

            Integration hue = registry().getIntegration("hue").join();

            assertFalse(hue.isBuiltIn());
            assertEquals("custom_integrations.hue", hue.getPkgPath());
        }

        @Test
        void safeModeIgnoresCustomIntegrations() throws IOException {
            Manifests.write(builtinDir, "hue", "{\"domain\": \"hue\"}");
            Manifests.writeCustom(customDir, "hue", "1.0.0");
            Manifests.writeCustom(customDir, "acme", "1.0.0");

            IntegrationRegistry registry = registry(
                    LoaderSettings.builder().configDir(configDir).builtinDir(builtinDir).safeMode(true));

            assertTrue(registry.getIntegration("hue").join().isBuiltIn());
            assertFalse(registry.getIntegrations(List.of("acme")).join().get("acme").isFound());
            assertTrue(registry.getCustomIntegrations().join().isEmpty());
        }

        @Test
        void customIntegrationsEnumeratedOnce() throws IOException {
            Manifests.writeCustom(customDir, "acme", "1.0.0");
            Manifests.writeCustom(customDir, "widget", "2.0");
            Files.createDirectories(customDir.resolve("__pycache__"));
            IntegrationRegistry registry = registry();

            Map<String, Integration> first = registry.getCustomIntegrations().join();
            Map<String, Integration> second = registry.getCustomIntegrations().join();

            assertEquals(List.of("acme", "widget"), List.copyOf(first.keySet()));
            assertSame(first, second);
            assertEquals(1, fileSystem.listings());
        }

        @Test
        void customWithoutVersionIsNotFound() throws IOException {
            Manifests.write(customDir, "nov", "{\"domain\": \"nov\"}");
            IntegrationRegistry registry = registry();

            var failed = assertInstanceOf(IntegrationResult.Failed.class,
                    registry.getIntegrations(List.of("nov")).join().get("nov"));
            assertInstanceOf(IntegrationNotFoundException.class, failed.error());
            assertTrue(registry.getCustomIntegrations().join().isEmpty());
        }

        @Test
        void customWithoutVersionFallsBackToBuiltin() throws IOException {
            Manifests.write(customDir, "nov", "{\"domain\": \"nov\"}");
            Manifests.write(builtinDir, "nov", "{\"domain\": \"nov\"}");

            Integration nov = registry().getIntegration("nov").join();

            assertTrue(nov.isBuiltIn());
            assertEquals("hearth.integrations.nov", nov.getPkgPath());
        }

        @Test
        void missingCustomDirectoryIsEmpty() throws IOException {
            Files.delete(customDir);

            assertTrue(registry().getCustomIntegrations().join().isEmpty());
        }
    }

    @Test
    void resultsFollowRequestOrder() throws IOException {
        Manifests.write(builtinDir, "b", "{\"domain\": \"b\"}");
        Manifests.write(builtinDir, "a", "{\"domain\": \"a\"}");

        Map<String, IntegrationResult> results = registry().getIntegrations(List.of("b", "x.y", "a", "b")).join();

        assertEquals(List.of("b", "x.y", "a"), List.copyOf(results.keySet()));
        assertTrue(results.get("a").isFound());
        assertTrue(results.get("b").isFound());
    }

    @Test
    void concurrentRequestsShareOneProbe() throws Exception {
        Path manifest = Manifests.write(builtinDir, "slow", "{\"domain\": \"slow\"}");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        fileSystem.gate(manifest, entered, release);
        IntegrationRegistry registry = registry();

        CompletableFuture<Integration> first = registry.getIntegration("slow");
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        CompletableFuture<Integration> second = registry.getIntegration("slow");
        CompletableFuture<Map<String, IntegrationResult>> batch = registry.getIntegrations(List.of("slow"));
        release.countDown();

        Integration integration = first.get(5, TimeUnit.SECONDS);
        assertSame(integration, second.get(5, TimeUnit.SECONDS));
        assertSame(integration, batch.get(5, TimeUnit.SECONDS).get("slow").orThrow());
        assertEquals(1, fileSystem.reads(manifest));
    }
}
