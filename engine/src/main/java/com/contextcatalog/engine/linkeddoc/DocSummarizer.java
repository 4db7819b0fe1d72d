package com.contextcatalog.engine.linkeddoc;

import com.contextcatalog.engine.provider.AiProvider;
import com.contextcatalog.engine.provider.ProviderInvokeOptions;
import com.contextcatalog.engine.provider.ProviderResponse;
import com.contextcatalog.engine.sandbox.IsolatedInvoker;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Produces the one-sentence summary of a linked document through the sandbox.
 *
 * Never throws: any provider or sandbox failure, and any answer shorter than
 * {@value #MIN_SUMMARY_LENGTH} characters, yields {@link #fallback(String)}.
 * Outcomes are counted as {@code catalog.linked_docs.summaries{outcome="ai|fallback"}}.
 */
@Component
public class DocSummarizer {

    private static final Logger log = LoggerFactory.getLogger(DocSummarizer.class);

    static final int MIN_SUMMARY_LENGTH = 10;

    private final IsolatedInvoker invoker;
    private final MeterRegistry meterRegistry;

    public DocSummarizer(IsolatedInvoker invoker, MeterRegistry meterRegistry) {
        this.invoker       = invoker;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param relativePath repo-relative path, used only in the fallback text
     */
    public String summarize(String relativePath, String content, AiProvider provider,
                            Duration timeout, boolean verbose) {
        String prompt = SummaryPrompts.summarization(content);
        try {
            ProviderResponse response = invoker.invokeIsolated(
                    provider, prompt, new ProviderInvokeOptions(null, timeout, verbose));
            String summary = response.result() == null ? "" : response.result().strip();
            if (summary.length() < MIN_SUMMARY_LENGTH) {
                log.debug("Summary for {} too short ({} chars), using fallback", relativePath, summary.length());
                return countFallback(relativePath);
            }
            meterRegistry.counter("catalog.linked_docs.summaries", "outcome", "ai").increment();
            return summary;
        } catch (RuntimeException e) {
            log.debug("Summarization failed for {}: {}", relativePath, e.getMessage());
            return countFallback(relativePath);
        }
    }

    public static String fallback(String relativePath) {
        return "Documentation file at " + relativePath + ". Summary unavailable.";
    }

    private String countFallback(String relativePath) {
        meterRegistry.counter("catalog.linked_docs.summaries", "outcome", "fallback").increment();
        return fallback(relativePath);
    }
}
