package com.e2eq.hierarchy.io;

import java.nio.file.Path;

/**
 * Thrown when a relation snapshot, hierarchy document or bundle file cannot be read or written.
 */
public class HierarchyIoException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final Path file;

    public HierarchyIoException(String message, Path file, Throwable cause) {
        super(message + ": " + file, cause);
        this.file = file;
    }

    /**
     * The file that could not be processed.
     */
    public Path getFile() {
        return file;
    }
}
