package com.contextcatalog.engine.artifact;

import java.nio.file.Path;

/**
 * A directory holding both an AGENTS.md and a CLAUDE.md, as found on disk
 * before any deduplication.
 */
public record ColocatedPair(Path directory, Path agentsPath, Path claudePath) {}
