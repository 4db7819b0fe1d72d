package com.contextcatalog.engine.skill;

/**
 * A valid SKILL.md as discovered, before content deduplication.
 *
 * @param path        repo-relative path of the SKILL.md file
 * @param directory   name of the directory holding the file
 * @param content     raw file content
 * @param contentHash SHA-256 of the raw bytes, lowercase hex
 */
public record SkillCandidate(
        String name,
        String description,
        String path,
        String directory,
        String content,
        String contentHash) {}
