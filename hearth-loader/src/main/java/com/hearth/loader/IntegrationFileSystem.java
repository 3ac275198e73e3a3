package com.hearth.loader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Filesystem operations the loader performs while probing integration roots.
 * Every call is blocking and only made from the worker pool.
 */
public interface IntegrationFileSystem {

    boolean isFile(Path path);

    boolean isDirectory(Path path);

    String readString(Path path) throws IOException;

    /**
     * Immediate sub directories of {@code dir}, sorted by name.
     */
    List<Path> listSubdirectories(Path dir) throws IOException;
}
