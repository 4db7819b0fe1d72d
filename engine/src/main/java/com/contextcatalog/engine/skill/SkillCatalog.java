package com.contextcatalog.engine.skill;

import java.util.List;

/**
 * Deduplicated skills of a repository.
 *
 * @param totalProcessed    number of valid SKILL.md files found
 * @param uniqueCount       number of distinct contents
 * @param duplicatesRemoved {@code totalProcessed - uniqueCount}
 */
public record SkillCatalog(
        List<Skill> skills,
        int         totalProcessed,
        int         uniqueCount,
        int         duplicatesRemoved) {

    public static SkillCatalog empty() {
        return new SkillCatalog(List.of(), 0, 0, 0);
    }
}
