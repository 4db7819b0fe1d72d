package com.contextcatalog.engine.provider;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Per-call settings for {@link AiProvider#invoke}.
 *
 * @param cwd     working directory the provider runs in
 * @param timeout upper bound on the call
 * @param verbose whether the provider may log its raw exchange
 */
public record ProviderInvokeOptions(Path cwd, Duration timeout, boolean verbose) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    public static ProviderInvokeOptions defaults() {
        return new ProviderInvokeOptions(null, DEFAULT_TIMEOUT, false);
    }

    public ProviderInvokeOptions withCwd(Path newCwd) {
        return new ProviderInvokeOptions(newCwd, timeout, verbose);
    }
}
