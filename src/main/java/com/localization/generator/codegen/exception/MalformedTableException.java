package com.localization.generator.codegen.exception;

import java.nio.file.Path;

/**
 * Thrown when a file cannot be read as a flat string-to-string table.
 * Aborts the whole generation run.
 */
public class MalformedTableException extends Exception {

    private static final long serialVersionUID = 1L;
    private final transient Path path;

    public MalformedTableException(Path path, String reason) {
        super("Invalid localization table at " + path + ": " + reason);
        this.path = path;
    }

    public MalformedTableException(Path path, String reason, Throwable cause) {
        super("Invalid localization table at " + path + ": " + reason, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
