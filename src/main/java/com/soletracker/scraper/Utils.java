package com.soletracker.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility class for common helper methods used in export and file operations.
 *
 * @author Sole Tracker Ingest Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\\\\\s]", "_");
    }

    /**
     * Creates a directory and its parents when missing.
     * @param dir directory to create
     * @return the directory
     * @throws IOException if it cannot be created
     */
    public static Path ensureDirectory(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            Files.createDirectories(dir);
            logger.debug("Created directory {}", dir.toAbsolutePath());
        }
        return dir;
    }

    /**
     * Collapses CR/LF runs into one space and trims, for single-line output such as CSV cells.
     * @param s Input string
     * @return Single-line string, empty for null
     */
    public static String singleLine(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
