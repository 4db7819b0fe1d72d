package com.contextcatalog.engine.skill;

import com.contextcatalog.engine.frontmatter.Frontmatter;

import java.util.Optional;

/**
 * The two mandatory fields of a SKILL.md manifest.
 */
public record SkillFrontmatter(String name, String description) {

    /**
     * Parse the frontmatter of a SKILL.md file. Empty when the block is missing
     * or either {@code name} or {@code description} is absent or blank.
     */
    public static Optional<SkillFrontmatter> parse(String content) {
        return Frontmatter.block(content).flatMap(yaml -> {
            Optional<String> name = Frontmatter.looseValue(yaml, "name");
            Optional<String> description = Frontmatter.looseValue(yaml, "description");
            if (name.isEmpty() || description.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new SkillFrontmatter(name.get(), description.get()));
        });
    }
}
