package com.tracepile.store.scan;

import java.nio.file.Path;

/**
 * A file path does not match the pattern its identity codes are taken from.
 */
public class FilenameAttributeException extends Exception {

    private final Path path;

    public FilenameAttributeException(Path path, String pattern) {
        super("File name " + path + " does not match pattern " + pattern);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
