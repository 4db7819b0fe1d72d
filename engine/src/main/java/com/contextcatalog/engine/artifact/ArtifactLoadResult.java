package com.contextcatalog.engine.artifact;

import java.util.List;

/**
 * @param artifacts      loaded artifacts, shallowest first
 * @param totalProcessed number of files offered for loading, unreadable ones included
 */
public record ArtifactLoadResult(List<ContextArtifact> artifacts, int totalProcessed) {

    public static ArtifactLoadResult empty() {
        return new ArtifactLoadResult(List.of(), 0);
    }
}
