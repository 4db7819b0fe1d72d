package com.contextcatalog.engine.fs;

/**
 * Thrown when a repository root cannot be traversed at all (missing,
 * not a directory, or the walk itself failed).
 *
 * This is the only failure that leaves the engine: without a valid root
 * no discovery is possible, so callers treat it as fatal.
 */
public class ScanException extends RuntimeException {

    public ScanException(String message) {
        super(message);
    }

    public ScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
