package com.contextcatalog.engine.artifact;

import com.contextcatalog.engine.frontmatter.Frontmatter;

/**
 * Scope metadata declared in the frontmatter of rule files.
 * All fields are null when absent or not applicable to the file's type.
 */
public record RuleMetadata(String globs, String description, Boolean alwaysApply) {

    public static final RuleMetadata NONE = new RuleMetadata(null, null, null);

    /**
     * Extract metadata for a file of the given type. Only rules files carry
     * {@code globs}; only cursor rules carry {@code description} and {@code alwaysApply}.
     */
    public static RuleMetadata from(ArtifactType type, String content) {
        if (!type.isRuleFile()) {
            return NONE;
        }
        return Frontmatter.block(content)
                .map(yaml -> new RuleMetadata(
                        Frontmatter.value(yaml, "globs").orElse(null),
                        type == ArtifactType.CURSOR_RULES
                                ? Frontmatter.value(yaml, "description").orElse(null) : null,
                        type == ArtifactType.CURSOR_RULES
                                ? Frontmatter.booleanValue(yaml, "alwaysApply").orElse(null) : null))
                .orElse(NONE);
    }
}
