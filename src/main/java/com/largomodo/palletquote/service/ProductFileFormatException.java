package com.largomodo.palletquote.service;

import java.io.IOException;

/**
 * Thrown when a product file cannot be parsed.
 * Carries the 1-based line number of the offending row (0 when the file as a whole is at fault).
 */
public class ProductFileFormatException extends IOException {

    private final int lineNumber;

    public ProductFileFormatException(String message, int lineNumber) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public ProductFileFormatException(String message, int lineNumber, Throwable cause) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message, cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
