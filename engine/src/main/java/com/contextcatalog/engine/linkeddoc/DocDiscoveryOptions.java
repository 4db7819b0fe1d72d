package com.contextcatalog.engine.linkeddoc;

import com.contextcatalog.engine.provider.AiProvider;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings for one linked-document discovery run.
 *
 * @param provider         model used for summaries
 * @param maxDocs          cap on documents read and summarized
 * @param maxContentLength per-document character limit before truncation
 * @param concurrency      parallel summarization calls, clamped to 1..10
 * @param timeout          per-call provider timeout
 * @param verbose          passed through to the provider
 */
public record DocDiscoveryOptions(
        AiProvider provider,
        int        maxDocs,
        int        maxContentLength,
        int        concurrency,
        Duration   timeout,
        boolean    verbose) {

    public static final int      DEFAULT_MAX_DOCS           = 30;
    public static final int      DEFAULT_MAX_CONTENT_LENGTH = 8000;
    public static final int      DEFAULT_CONCURRENCY        = 2;
    public static final Duration DEFAULT_TIMEOUT            = Duration.ofSeconds(60);

    static final int MAX_CONCURRENCY = 10;

    public DocDiscoveryOptions {
        Objects.requireNonNull(provider, "provider");
        maxDocs = Math.max(0, maxDocs);
        maxContentLength = Math.max(1, maxContentLength);
        concurrency = Math.max(1, Math.min(MAX_CONCURRENCY, concurrency));
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
    }

    public static DocDiscoveryOptions defaults(AiProvider provider) {
        return new DocDiscoveryOptions(provider, DEFAULT_MAX_DOCS, DEFAULT_MAX_CONTENT_LENGTH,
                DEFAULT_CONCURRENCY, DEFAULT_TIMEOUT, false);
    }

    public DocDiscoveryOptions withMaxDocs(int value) {
        return new DocDiscoveryOptions(provider, value, maxContentLength, concurrency, timeout, verbose);
    }

    public DocDiscoveryOptions withMaxContentLength(int value) {
        return new DocDiscoveryOptions(provider, maxDocs, value, concurrency, timeout, verbose);
    }

    public DocDiscoveryOptions withConcurrency(int value) {
        return new DocDiscoveryOptions(provider, maxDocs, maxContentLength, value, timeout, verbose);
    }

    public DocDiscoveryOptions withTimeout(Duration value) {
        return new DocDiscoveryOptions(provider, maxDocs, maxContentLength, concurrency, value, verbose);
    }

    public DocDiscoveryOptions withVerbose(boolean value) {
        return new DocDiscoveryOptions(provider, maxDocs, maxContentLength, concurrency, timeout, value);
    }
}
