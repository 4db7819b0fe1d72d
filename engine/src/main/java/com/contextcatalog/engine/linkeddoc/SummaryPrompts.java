package com.contextcatalog.engine.linkeddoc;

/**
 * Prompt used to summarize one linked document.
 *
 * The document's path is deliberately absent: given a path, agentic CLI tools
 * tend to go and open the file instead of summarizing the text they were given.
 */
public final class SummaryPrompts {

    private SummaryPrompts() {}

    public static String summarization(String content) {
        return SUMMARIZATION_PROMPT.replace("{{CONTENT}}", content);
    }

    // ------------------------------------------------------------------
    // Template  ({{CONTENT}} is replaced per document)
    // ------------------------------------------------------------------

    private static final String SUMMARIZATION_PROMPT = """
            You are a documentation summarizer for AI coding agents.

            Given the following Markdown documentation, provide a single detailed sentence \
            that describes both the document's purpose and the key information it contains \
            for developers/AI agents.

            IMPORTANT:
            - Respond with ONLY 1 detailed sentence, nothing else
            - Be specific and actionable, avoid vague statements
            - Focus on information useful for coding tasks

            ---

            ```markdown
            {{CONTENT}}
            ```""";
}
