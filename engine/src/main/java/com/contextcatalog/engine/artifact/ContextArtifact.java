package com.contextcatalog.engine.artifact;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A documentation file written for AI coding agents, as loaded from the repository.
 *
 * @param path        repo-relative path, {@code /}-separated
 * @param type        category inferred from the path
 * @param content     file content, possibly truncated
 * @param globs       rule scope from frontmatter (rules and cursor rules only), raw text
 * @param description rule description from frontmatter (cursor rules only)
 * @param alwaysApply whether a cursor rule applies to every request, if declared
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContextArtifact(
        String       path,
        ArtifactType type,
        String       content,
        String       globs,
        String       description,
        Boolean      alwaysApply) {

    public static ContextArtifact of(String path, ArtifactType type, String content, RuleMetadata rule) {
        return new ContextArtifact(path, type, content,
                rule.globs(), rule.description(), rule.alwaysApply());
    }
}
