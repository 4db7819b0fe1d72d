package com.contextcatalog.engine.skill;

import com.contextcatalog.engine.fs.RepoPaths;
import com.contextcatalog.engine.fs.RepositoryScanner;
import com.contextcatalog.engine.fs.ScanPattern;
import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Discovers SKILL.md manifests and collapses byte-identical copies into one
 * catalog entry.
 *
 * A skill is valid only when its frontmatter declares both {@code name} and
 * {@code description}; anything else is skipped without error. Identity is the
 * SHA-256 of the raw file bytes, so two copies that differ only in whitespace
 * count as two skills.
 */
@Component
public class SkillCatalogBuilder {

    private static final Logger log = LoggerFactory.getLogger(SkillCatalogBuilder.class);

    private final RepositoryScanner scanner;

    public SkillCatalogBuilder(RepositoryScanner scanner) {
        this.scanner = scanner;
    }

    /** Discover and deduplicate in one step. */
    public SkillCatalog build(Path baseDir, Integer maxDepth) {
        return summarizeAndDeduplicate(findSkills(baseDir, maxDepth));
    }

    // ------------------------------------------------------------------
    // Discovery
    // ------------------------------------------------------------------

    /**
     * Valid skills under {@code baseDir}, shallowest first.
     *
     * @param maxDepth deepest directory level to include (root = 0); null for unlimited
     */
    public List<SkillCandidate> findSkills(Path baseDir, Integer maxDepth) {
        List<Path> files = RepositoryScanner.withinDepth(
                baseDir, scanner.scan(baseDir, ScanPattern.SKILL), maxDepth);

        List<SkillCandidate> candidates = new ArrayList<>();
        for (Path file : files) {
            toCandidate(baseDir, file).ifPresent(candidates::add);
        }
        candidates.sort(RepoPaths.byDepth(SkillCandidate::path));
        log.debug("Found {} valid skill(s) among {} SKILL.md file(s) under {}",
                candidates.size(), files.size(), baseDir);
        return candidates;
    }

    private Optional<SkillCandidate> toCandidate(Path baseDir, Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            log.debug("Error reading {}: {}", file, e.getMessage());
            return Optional.empty();
        }

        String content = new String(bytes, StandardCharsets.UTF_8);
        Optional<SkillFrontmatter> frontmatter = SkillFrontmatter.parse(content);
        if (frontmatter.isEmpty()) {
            log.debug("Skipping {}: invalid or missing YAML frontmatter", file);
            return Optional.empty();
        }

        Path parent = file.getParent();
        return Optional.of(new SkillCandidate(
                frontmatter.get().name(),
                frontmatter.get().description(),
                RepoPaths.relativize(baseDir, file),
                parent == null ? "" : RepoPaths.fileName(parent),
                content,
                DigestUtils.sha256Hex(bytes)));
    }

    // ------------------------------------------------------------------
    // Deduplication
    // ------------------------------------------------------------------

    /**
     * Group candidates by content hash. The first candidate of each group (in the
     * given order) represents it; the others become its {@code duplicatePaths}.
     * The summary is the declared description; no model is consulted.
     */
    public SkillCatalog summarizeAndDeduplicate(List<SkillCandidate> candidates) {
        if (candidates.isEmpty()) {
            return SkillCatalog.empty();
        }

        Map<String, List<SkillCandidate>> byHash = new LinkedHashMap<>();
        for (SkillCandidate candidate : candidates) {
            byHash.computeIfAbsent(candidate.contentHash(), h -> new ArrayList<>()).add(candidate);
        }

        List<Skill> skills = new ArrayList<>();
        for (List<SkillCandidate> group : byHash.values()) {
            SkillCandidate first = group.get(0);
            List<String> duplicates = group.subList(1, group.size()).stream()
                    .map(SkillCandidate::path)
                    .toList();
            if (!duplicates.isEmpty()) {
                log.debug("Skill '{}' at {} has {} duplicate(s): {}",
                        first.name(), first.path(), duplicates.size(), duplicates);
            }
            skills.add(Skill.representing(first, duplicates));
        }
        skills.sort(RepoPaths.byDepth(Skill::path));

        int total = candidates.size();
        return new SkillCatalog(skills, total, skills.size(), total - skills.size());
    }
}
