package com.contextcatalog.engine.artifact;

/**
 * What directory-local deduplication keeps of a colocated AGENTS.md/CLAUDE.md pair.
 */
public enum PairDecision {
    /** Trimmed contents are identical; AGENTS.md is the preferred name. */
    IDENTICAL_KEEP_AGENTS(true, false),
    /** CLAUDE.md is an {@code @} pointer to AGENTS.md. */
    POINTER_KEEP_AGENTS(true, false),
    /** AGENTS.md is an {@code @} pointer to CLAUDE.md. */
    POINTER_KEEP_CLAUDE(false, true),
    /** Contents differ and neither points at the other. */
    DISTINCT_KEEP_BOTH(true, true),
    /** At least one file could not be read; keep both rather than lose data. */
    UNREADABLE_KEEP_BOTH(true, true);

    private final boolean keepsAgents;
    private final boolean keepsClaude;

    PairDecision(boolean keepsAgents, boolean keepsClaude) {
        this.keepsAgents = keepsAgents;
        this.keepsClaude = keepsClaude;
    }

    public boolean keepsAgents() {
        return keepsAgents;
    }

    public boolean keepsClaude() {
        return keepsClaude;
    }
}
