package com.contextcatalog.engine.linkeddoc;

/**
 * A linked documentation file with its one-sentence summary.
 *
 * @param path       repo-relative path of the document
 * @param linkedFrom repo-relative path of the context file that first linked it
 * @param content    document content, possibly truncated
 */
public record LinkedDocSummary(String path, String summary, String linkedFrom, String content) {}
