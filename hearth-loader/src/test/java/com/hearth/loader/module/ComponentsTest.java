package com.hearth.loader.module;

import com.hearth.loader.ComponentImportException;
import com.hearth.loader.HostContext;
import com.hearth.loader.LoaderSettings;
import com.hearth.loader.Manifests;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ComponentsTest {

    @TempDir
    Path tempDir;

    Path builtinDir;
    HostContext host;

    @BeforeEach
    void setUp() throws IOException {
        builtinDir = Files.createDirectories(tempDir.resolve("builtin"));
        MapNamespace custom = new MapNamespace()
                .put("hue", () -> registrar -> registrar.function("ping", args -> "custom pong"));
        host = HostContext.builder()
                .settings(LoaderSettings.builder().configDir(tempDir.resolve("config")).builtinDir(builtinDir).build())
                .customNamespace(custom)
                .build();
    }

    @AfterEach
    void tearDown() {
        host.close();
    }

    @Test
    void legacyLookupWhenNotInRegistry() {
        ComponentHandle hue = host.getComponents().get("hue");

        assertEquals("custom pong", hue.call("ping"));
        assertSame(hue, host.getComponents().get("hue"));
    }

    @Test
    void resolvedIntegrationLoadsFromItsRoot() throws IOException {
        Manifests.write(builtinDir, "hue", "{\"domain\": \"hue\"}");
        host.getRegistry().getIntegration("hue").join();

        ComponentHandle hue = host.getComponents().get("hue");

        assertTrue(hue.isBuiltIn());
        assertEquals("pong", hue.call("ping"));
    }

    @Test
    void unknownComponent() {
        ComponentImportException thrown = assertThrows(ComponentImportException.class,
                () -> host.getComponents().get("nope"));

        assertEquals("Unable to load nope", thrown.getMessage());
        assertEquals("nope", thrown.getModuleName());
    }

    @Test
    void resolvedIntegrationWithoutModule() throws IOException {
        Manifests.write(builtinDir, "nomodule", "{\"domain\": \"nomodule\"}");
        host.getRegistry().getIntegration("nomodule").join();

        ComponentImportException thrown = assertThrows(ComponentImportException.class,
                () -> host.getComponents().get("nomodule"));

        assertEquals("Unable to load nomodule", thrown.getMessage());
        assertInstanceOf(ComponentImportException.class, thrown.getCause());
    }

    @Test
    void helpersComeFromBuiltinNamespace() {
        Helpers helpers = host.getHelpers();

        ComponentHandle sun = helpers.get("sun");

        assertEquals(true, sun.call("is_up"));
        assertEquals("helpers.sun", sun.getName());
        assertSame(sun, helpers.get("sun"));
        assertThrows(ComponentImportException.class, () -> helpers.get("moon"));
    }
}
