package com.contextcatalog.engine.provider;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Answer of one provider call. Cost and duration are null when the provider
 * does not report them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderResponse(String result, Double costUsd, Long durationMs) {

    public static ProviderResponse of(String result) {
        return new ProviderResponse(result, null, null);
    }
}
