package com.localization.generator.codegen.model.input;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported table file formats, recognised by extension.
 */
public enum TableFormat {
    /**
     * Apple strings file: {@code "key" = "value";}.
     */
    STRINGS(".strings"),

    /**
     * Java properties file: {@code key=value}.
     */
    PROPERTIES(".properties");

    private final String extension;

    TableFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public static Optional<TableFormat> forPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        for (TableFormat format : values()) {
            if (name.endsWith(format.extension)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
