package com.contextcatalog.engine.concurrent;

/**
 * Result of one task run by {@link ConcurrencyLimiter}: either a value or the
 * failure that task raised.
 */
public record TaskOutcome<R>(R value, Throwable failure) {

    public static <R> TaskOutcome<R> success(R value) {
        return new TaskOutcome<>(value, null);
    }

    public static <R> TaskOutcome<R> failure(Throwable failure) {
        return new TaskOutcome<>(null, failure);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
