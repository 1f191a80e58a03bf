package com.localization.generator.codegen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for writing generated sources.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes content to a file as UTF-8, creating parent directories if needed.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Writes content unless the file already holds exactly that text, leaving
     * its modification time alone for incremental builds.
     *
     * @return true when the file was written
     */
    public static boolean writeIfChanged(Path filePath, String content) throws IOException {
        if (Files.isRegularFile(filePath) && Files.readString(filePath, StandardCharsets.UTF_8).equals(content)) {
            return false;
        }
        safeWriteString(filePath, content);
        return true;
    }
}
