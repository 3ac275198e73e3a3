package com.hearth.loader.module;

import java.util.List;

/**
 * Component modules registered for tests in
 * {@code META-INF/services/com.hearth.loader.module.ComponentModule}.
 */
public final class SampleModules {

    private SampleModules() {
    }

    @ModuleName("hue")
    public static class Hue implements ComponentModule {

        private int declarations;

        @Override
        public void declare(CapabilityRegistrar registrar) {
            declarations++;
            registrar.function("ping", args -> "pong");
            registrar.hostBound("safe_mode", (host, args) -> host.isSafeMode());
        }

        public int declarations() {
            return declarations;
        }
    }

    @ModuleName("hue.light")
    public static class HueLight implements ComponentModule {

        @Override
        public void declare(CapabilityRegistrar registrar) {
            registrar.function("turn_on", args -> "on:" + args[0]);
        }
    }

    @ModuleName("helpers.sun")
    public static class SunHelper implements ComponentModule {

        @Override
        public void declare(CapabilityRegistrar registrar) {
            registrar.function("is_up", args -> true);
        }
    }

    @ModuleName("legacy_switch")
    public static class LegacySwitch implements ComponentModule {

        @Override
        public void declare(CapabilityRegistrar registrar) {
            registrar.function("toggle", args -> "toggled");
        }

        @Override
        public List<String> dependencies() {
            return List.of("hue");
        }

        @Override
        public List<String> requirements() {
            return List.of("switchlib==1.0");
        }
    }

    @ModuleName("broken")
    public static class Broken implements ComponentModule {

        public Broken() {
            throw new IllegalStateException("missing native library");
        }

        @Override
        public void declare(CapabilityRegistrar registrar) {
        }
    }
}
