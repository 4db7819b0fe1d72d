package com.contextcatalog.engine.skill;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One distinct skill in the catalog. Copies of the same SKILL.md content found
 * elsewhere in the repository are listed in {@code duplicatePaths}, which is
 * null when there are none.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Skill(
        String       name,
        String       description,
        String       path,
        String       directory,
        String       contentHash,
        List<String> duplicatePaths,
        String       summary,
        String       content) {

    public Skill {
        duplicatePaths = duplicatePaths == null || duplicatePaths.isEmpty()
                ? null : List.copyOf(duplicatePaths);
    }

    static Skill representing(SkillCandidate first, List<String> duplicatePaths) {
        return new Skill(first.name(), first.description(), first.path(), first.directory(),
                first.contentHash(), duplicatePaths, first.description(), first.content());
    }
}
