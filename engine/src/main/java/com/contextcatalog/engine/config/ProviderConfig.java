package com.contextcatalog.engine.config;

import com.contextcatalog.engine.provider.AiProvider;
import com.contextcatalog.engine.provider.CommandAiProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the AI provider used for linked-document summaries.
 *
 * Without {@code catalog.provider.command} no provider bean exists and the
 * catalog is built without linked documentation.
 */
@Configuration
public class ProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "catalog.provider", name = "command")
    AiProvider commandAiProvider(@Value("${catalog.provider.command}") String command) {
        CommandAiProvider provider = new CommandAiProvider(command);
        if (provider.isAvailable()) {
            log.info("Using AI provider: {}", provider.displayName());
        } else {
            log.warn("AI provider command not found on PATH: {}", provider.displayName());
        }
        return provider;
    }
}
