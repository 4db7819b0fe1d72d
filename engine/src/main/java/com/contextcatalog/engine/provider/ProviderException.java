package com.contextcatalog.engine.provider;

/**
 * Thrown when an AI provider call fails.
 *
 * Unchecked; the linked-document stage catches it per document and falls back
 * to a generic summary.
 */
public class ProviderException extends RuntimeException {

    public enum Kind { TIMEOUT, PROCESS_ERROR, UNAVAILABLE, EMPTY_RESPONSE }

    private final Kind kind;

    public ProviderException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
