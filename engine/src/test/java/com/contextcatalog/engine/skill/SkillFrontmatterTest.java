package com.contextcatalog.engine.skill;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SkillFrontmatterTest {

    @Test
    void parse_quotedValues_stripped() {
        assertThat(SkillFrontmatter.parse("---\nname: 'pdf'\ndescription: \"Fill PDF forms\"\n---\n"))
                .contains(new SkillFrontmatter("pdf", "Fill PDF forms"));
    }

    @Test
    void parse_blankField_empty() {
        assertThat(SkillFrontmatter.parse("---\nname: pdf\ndescription:   \n---\n")).isEmpty();
    }

    @Test
    void parse_noBlock_empty() {
        assertThat(SkillFrontmatter.parse("name: pdf\ndescription: x\n")).isEmpty();
    }
}
