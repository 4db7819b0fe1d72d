package com.contextcatalog.engine.linkeddoc;

import java.util.List;

/**
 * @param totalLinksFound distinct link targets across all sources, before the document cap
 * @param unresolvedLinks raw targets of links whose file could not be read
 */
public record LinkedDocsResult(List<LinkedDocSummary> docs, int totalLinksFound, List<String> unresolvedLinks) {

    public static LinkedDocsResult empty() {
        return new LinkedDocsResult(List.of(), 0, List.of());
    }
}
