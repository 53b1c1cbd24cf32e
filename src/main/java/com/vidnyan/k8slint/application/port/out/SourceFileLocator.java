package com.vidnyan.k8slint.application.port.out;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Output port for finding the files to lint under a path.
 */
public interface SourceFileLocator {

    /**
     * @param root a single file (returned as is) or a directory to search recursively
     * @return files in a stable order
     */
    List<Path> locate(Path root) throws IOException;
}
