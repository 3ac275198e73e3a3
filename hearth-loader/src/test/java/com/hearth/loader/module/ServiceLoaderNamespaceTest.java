package com.hearth.loader.module;

import ch.qos.logback.classic.Level;
import com.hearth.loader.LogCapture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ServiceLoaderNamespaceTest {

    @TempDir
    Path tempDir;

    private final ClassLoader testLoader = getClass().getClassLoader();

    @Test
    void classLoaderNamespaceSeesRegisteredModules() {
        try (ServiceLoaderNamespace namespace = ServiceLoaderNamespace.forClassLoader("builtin", testLoader)) {
            assertInstanceOf(SampleModules.Hue.class, namespace.find("hue").orElseThrow());
            assertInstanceOf(SampleModules.HueLight.class, namespace.find("hue.light").orElseThrow());
            assertTrue(namespace.find("nope").isEmpty());
            assertEquals("builtin", namespace.name());
        }
    }

    @Test
    void directoryNamespaceOnlyAnswersWithItsOwnModules() {
        try (ServiceLoaderNamespace namespace = ServiceLoaderNamespace.forDirectory("custom", tempDir, testLoader)) {
            assertTrue(namespace.find("hue").isEmpty());
        }
    }

    @Test
    void missingDirectoryIsEmpty() {
        try (ServiceLoaderNamespace namespace =
                ServiceLoaderNamespace.forDirectory("custom", tempDir.resolve("missing"), testLoader)) {
            assertTrue(namespace.find("hue").isEmpty());
        }
    }

    @Test
    void directoryCreatedAfterFirstLookupIsPickedUp() throws Exception {
        Path custom = tempDir.resolve("custom_integrations");
        try (LogCapture logs = LogCapture.of(ServiceLoaderNamespace.class);
                ServiceLoaderNamespace namespace = ServiceLoaderNamespace.forDirectory("custom", custom, testLoader)) {
            assertTrue(namespace.find("hue").isEmpty());
            assertFalse(logs.contains(Level.DEBUG, "Built class loader for custom"));

            Files.createDirectories(custom);

            assertTrue(namespace.find("hue").isEmpty());
            assertTrue(logs.contains(Level.DEBUG, "Built class loader for custom with 0 jar(s)"));
        }
    }
}
