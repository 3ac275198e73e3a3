package com.hearth.loader.manifest;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Parsed {@code manifest.json} of an integration.
 * Discovery fragments are empty when the manifest does not declare them.
 */
@Value
@Builder
public class Manifest {
    String domain;
    String name;
    String disabled;
    @Builder.Default
    IntegrationType integrationType = IntegrationType.INTEGRATION;
    @Builder.Default
    List<String> dependencies = List.of();
    @Builder.Default
    List<String> afterDependencies = List.of();
    @Builder.Default
    List<String> requirements = List.of();
    boolean configFlow;
    String documentation;
    String issueTracker;
    String qualityScale;
    String iotClass;
    String version;
    @Builder.Default
    List<String> codeowners = List.of();
    @Builder.Default
    List<String> loggers = List.of();

    // --- discovery fragments ---

    /** Service types, either plain strings or matcher objects with a {@code type}. */
    @Builder.Default
    List<Object> zeroconf = List.of();
    @Builder.Default
    List<Map<String, Object>> ssdp = List.of();
    @Builder.Default
    List<Map<String, Object>> bluetooth = List.of();
    @Builder.Default
    List<Map<String, Object>> dhcp = List.of();
    @Builder.Default
    List<Map<String, Object>> usb = List.of();
    @Builder.Default
    Map<String, List<String>> homekit = Map.of();
    @Builder.Default
    List<String> mqtt = List.of();
}
