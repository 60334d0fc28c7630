package com.tracepile.core.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A file could be read but its content is not a valid trace file.
 * Callers catching {@link IOException} should catch this first to tell malformed
 * files apart from read failures.
 */
public class FileLoadException extends IOException {

    private final Path path;

    public FileLoadException(Path path, String message) {
        super("Cannot load " + path + ": " + message);
        this.path = path;
    }

    public FileLoadException(Path path, String message, Throwable cause) {
        super("Cannot load " + path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
