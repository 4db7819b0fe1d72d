package com.contextcatalog.engine.catalog;

import com.contextcatalog.engine.artifact.ContextArtifact;
import com.contextcatalog.engine.linkeddoc.LinkedDocSummary;
import com.contextcatalog.engine.skill.Skill;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything an evaluator needs to know about a repository's AI-agent context:
 * the context files themselves, the skills it ships and the documentation those
 * files link to.
 *
 * @param baseDir                 absolute repository root
 * @param skillsDuplicatesRemoved SKILL.md copies collapsed into another entry
 * @param totalLinksFound         distinct link targets before the document cap
 * @param unresolvedLinks         raw link targets that could not be read
 */
public record ContextCatalog(
        String                 baseDir,
        List<ContextArtifact>  artifacts,
        List<Skill>            skills,
        int                    skillsDuplicatesRemoved,
        List<LinkedDocSummary> linkedDocs,
        int                    totalLinksFound,
        List<String>           unresolvedLinks) {

    /** Context files located (AGENTS.md, CLAUDE.md, instructions and rules alike). */
    @JsonProperty
    public int agentsFileCount() {
        return artifacts.size();
    }

    @JsonProperty
    public int skillsCount() {
        return skills.size();
    }

    @JsonProperty
    public int linkedDocsCount() {
        return linkedDocs.size();
    }
}
