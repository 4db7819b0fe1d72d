package com.contextcatalog.engine.artifact;

import com.contextcatalog.engine.fs.RepoPaths;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Category of a context artifact, inferred from its path.
 *
 * Path-based categories win over file-name ones: a file under
 * {@code .claude/rules/} is a rule even if it is called {@code agents.md}.
 */
public enum ArtifactType {
    AGENTS("agents"),
    CLAUDE("claude"),
    COPILOT("copilot"),
    RULES("rules"),
    CURSOR_RULES("cursor-rules"),
    SKILLS("skills");

    private static final List<String> SKILL_DIRECTORIES = List.of(
            ".cursor/skills/", ".claude/skills/", ".agents/skills/", ".github/skills/");

    private final String wireName;

    ArtifactType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** True for the categories whose frontmatter carries {@code globs}. */
    public boolean isRuleFile() {
        return this == RULES || this == CURSOR_RULES;
    }

    /**
     * Infer the category of a context file from its (absolute or repo-relative) path.
     * Unknown files default to {@link #AGENTS}.
     */
    public static ArtifactType of(String path) {
        String normalized = RepoPaths.normalizedForMatch(path);

        if (normalized.contains(".cursor/rules/")) {
            return CURSOR_RULES;
        }
        if (SKILL_DIRECTORIES.stream().anyMatch(normalized::contains)) {
            return SKILLS;
        }
        if (normalized.contains(".claude/rules/")) {
            return RULES;
        }

        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        if (fileName.contains("agents")) {
            return AGENTS;
        }
        if (fileName.contains("claude")) {
            return CLAUDE;
        }
        if (fileName.contains("copilot")) {
            return COPILOT;
        }
        if (fileName.endsWith(".instructions.md") && normalized.contains(".github/instructions/")) {
            return COPILOT;
        }
        return AGENTS;
    }
}
