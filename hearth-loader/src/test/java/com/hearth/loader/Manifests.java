package com.hearth.loader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes integration directories for tests.
 */
public final class Manifests {

    private Manifests() {
    }

    public static Path write(Path root, String domain, String json) throws IOException {
        Path dir = Files.createDirectories(root.resolve(domain));
        return Files.writeString(dir.resolve("manifest.json"), json);
    }

    public static Path write(Path root, String domain, List<String> dependencies) throws IOException {
        return write(root, domain, "{\"domain\": \"" + domain + "\", \"dependencies\": " + jsonList(dependencies) + "}");
    }

    public static Path writeCustom(Path root, String domain, String version) throws IOException {
        return write(root, domain, "{\"domain\": \"" + domain + "\", \"version\": \"" + version + "\"}");
    }

    public static String jsonList(List<String> values) {
        return values.stream().map(v -> "\"" + v + "\"").collect(Collectors.joining(", ", "[", "]"));
    }
}
