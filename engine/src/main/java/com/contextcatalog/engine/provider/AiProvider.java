package com.contextcatalog.engine.provider;

/**
 * An AI backend that answers a single prompt.
 *
 * Implementations must be safe to call from several threads at once; each call
 * carries its own working directory in {@link ProviderInvokeOptions}.
 */
public interface AiProvider {

    /** Short machine name, used as a metric tag. */
    String name();

    String displayName();

    /** Whether the backend can be invoked right now (binary installed, credentials present). */
    boolean isAvailable();

    /**
     * Send {@code prompt} and wait for the answer.
     *
     * @throws ProviderException on timeout, process failure or an empty answer
     */
    ProviderResponse invoke(String prompt, ProviderInvokeOptions options);
}
