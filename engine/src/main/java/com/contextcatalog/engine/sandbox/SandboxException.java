package com.contextcatalog.engine.sandbox;

/**
 * Thrown when a sandbox directory cannot be created. Nothing has been sent to
 * the provider at that point.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }
}
