package com.vbaflow.analyzer.static_analysis;

import java.nio.file.Path;

/**
 * A module file (or previously written document) named on input does not exist.
 */
public class ModuleFileNotFoundException extends RuntimeException {

    private final Path path;

    public ModuleFileNotFoundException(Path path) {
        super("File not found: " + path);
        this.path = path;
    }

    public Path getPath() { return path; }
}
