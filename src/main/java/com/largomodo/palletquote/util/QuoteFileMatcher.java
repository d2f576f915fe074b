package com.largomodo.palletquote.util;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Product file detection for batch mode.
 * <p>
 * Stateless utility performing filesystem checks. Safe for concurrent use.
 */
public class QuoteFileMatcher {

    private static final String EXTENSION = ".csv";

    private QuoteFileMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * @param path file path to check (can be null)
     * @return true if path is a regular file with a {@code .csv} extension (any case)
     */
    public static boolean isQuoteFile(Path path) {
        if (path == null) {
            return false;  // Safe filter predicate semantics
        }
        if (!Files.isRegularFile(path)) {
            return false;
        }
        return path.getFileName().toString().toLowerCase().endsWith(EXTENSION);
    }
}
