package com.hearth.loader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * {@link IntegrationFileSystem} backed by {@link java.nio.file.Files}.
 */
public class LocalIntegrationFileSystem implements IntegrationFileSystem {

    @Override
    public boolean isFile(Path path) {
        return Files.isRegularFile(path);
    }

    @Override
    public boolean isDirectory(Path path) {
        return Files.isDirectory(path);
    }

    @Override
    public String readString(Path path) throws IOException {
        return Files.readString(path);
    }

    @Override
    public List<Path> listSubdirectories(Path dir) throws IOException {
        try (Stream<Path> children = Files.list(dir)) {
            return children.filter(Files::isDirectory).sorted().toList();
        }
    }
}
