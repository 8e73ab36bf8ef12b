package com.phylogenetics.nexus.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File helpers for reading NEXUS sources and writing regenerated files.
 */
public class FileWriteUtil {

    private FileWriteUtil() {
        // Utility class
    }

    /**
     * Writes a rendered NEXUS document as UTF-8, creating the output file's parent
     * directories when a command is pointed at a new location.
     */
    public static void safeWriteString(Path filePath, String content) throws IOException {
        Path parentDir = filePath.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(filePath, content, StandardCharsets.UTF_8);
    }

    /**
     * Reads a whole text file, naming the file in the exception when it cannot be read.
     */
    public static String readString(Path filePath) throws IOException {
        if (!Files.isReadable(filePath)) {
            throw new IOException("Unable to read file " + filePath);
        }
        return Files.readString(filePath, StandardCharsets.UTF_8);
    }
}
