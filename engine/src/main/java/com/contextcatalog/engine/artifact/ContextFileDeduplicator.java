package com.contextcatalog.engine.artifact;

import com.contextcatalog.engine.fs.ContentReader;
import com.contextcatalog.engine.fs.RepoPaths;
import com.contextcatalog.engine.reference.CrossReferenceDetector;
import com.contextcatalog.engine.reference.CrossReferenceDetector.CrossReference;
import com.contextcatalog.engine.reference.CrossReferenceDetector.PairMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Content-based deduplication of context files that survived symlink resolution.
 *
 * <ol>
 *   <li>Directory-local: an AGENTS.md/CLAUDE.md pair in one directory collapses to one
 *       file when the contents are identical or one is a pointer to the other.</li>
 *   <li>Global: a Copilot instructions file whose content duplicates any AGENTS.md or
 *       CLAUDE.md anywhere in the repository is dropped.</li>
 * </ol>
 *
 * Every read failure keeps the files involved: over-inclusion beats data loss.
 */
final class ContextFileDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(ContextFileDeduplicator.class);

    private ContextFileDeduplicator() {}

    // ------------------------------------------------------------------
    // Directory-local pairs
    // ------------------------------------------------------------------

    /** Drops the redundant member of each colocated pair; everything else keeps its position. */
    static List<Path> deduplicateColocated(List<Path> files) {
        Map<Path, List<Path>> byDirectory = new LinkedHashMap<>();
        for (Path file : files) {
            byDirectory.computeIfAbsent(file.getParent(), dir -> new ArrayList<>()).add(file);
        }

        Set<Path> dropped = new HashSet<>();
        byDirectory.values().forEach(inDir -> {
            Optional<Path> agents = findByName(inDir, "agents.md");
            Optional<Path> claude = findByName(inDir, "claude.md");
            if (agents.isEmpty() || claude.isEmpty()) {
                return;
            }
            PairDecision decision = decidePair(agents.get(), claude.get());
            if (!decision.keepsAgents()) {
                dropped.add(agents.get());
            }
            if (!decision.keepsClaude()) {
                dropped.add(claude.get());
            }
        });

        return files.stream().filter(file -> !dropped.contains(file)).toList();
    }

    /**
     * Compare a colocated pair. The two files are read concurrently.
     */
    static PairDecision decidePair(Path agentsFile, Path claudeFile) {
        CompletableFuture<Optional<String>> agentsRead = CompletableFuture.supplyAsync(() -> ContentReader.read(agentsFile));
        Optional<String> claudeContent = ContentReader.read(claudeFile);
        Optional<String> agentsContent = agentsRead.join();

        if (agentsContent.isEmpty() || claudeContent.isEmpty()) {
            log.debug("Error reading files in {}, keeping both", agentsFile.getParent());
            return PairDecision.UNREADABLE_KEEP_BOTH;
        }
        if (ContentReader.trim(agentsContent.get()).equals(ContentReader.trim(claudeContent.get()))) {
            log.debug("Deduplicated: {} (identical to {})", claudeFile, agentsFile);
            return PairDecision.IDENTICAL_KEEP_AGENTS;
        }
        CrossReference ref = CrossReferenceDetector.detectCrossReference(agentsContent.get(), claudeContent.get());
        if (ref.hasReference()) {
            if (ref.contentFile() == PairMember.AGENTS) {
                log.debug("Deduplicated: {} (file reference to {})", claudeFile, agentsFile);
                return PairDecision.POINTER_KEEP_AGENTS;
            }
            log.debug("Deduplicated: {} (file reference to {})", agentsFile, claudeFile);
            return PairDecision.POINTER_KEEP_CLAUDE;
        }
        log.debug("Keeping both files in {} (different content)", agentsFile.getParent());
        return PairDecision.DISTINCT_KEEP_BOTH;
    }

    private static Optional<Path> findByName(List<Path> files, String lowerName) {
        return files.stream()
                .filter(f -> RepoPaths.fileName(f).toLowerCase(Locale.ROOT).equals(lowerName))
                .findFirst();
    }

    // ------------------------------------------------------------------
    // Global Copilot instructions
    // ------------------------------------------------------------------

    static List<Path> deduplicateCopilotInstructions(List<Path> files) {
        if (files.stream().noneMatch(ContextFileDeduplicator::isCopilotInstructions)) {
            return files;
        }

        // Exact trimmed equality against every AGENTS.md / CLAUDE.md, via a content index.
        Set<String> agentContents = files.parallelStream()
                .filter(ContextFileDeduplicator::isAgentsOrClaude)
                .map(ContentReader::readTrimmed)
                .flatMap(Optional::stream)
                .collect(Collectors.toSet());

        List<Path> result = new ArrayList<>();
        for (Path file : files) {
            if (!isCopilotInstructions(file)) {
                result.add(file);
                continue;
            }
            Optional<String> content = ContentReader.readTrimmed(file);
            if (content.isPresent() && agentContents.contains(content.get())) {
                log.debug("Deduplicated: {} (identical content to an AGENTS.md/CLAUDE.md)", file);
                continue;
            }
            result.add(file);
        }
        return result;
    }

    /**
     * {@code copilot-instructions.md} anywhere, or {@code *.instructions.md} under
     * {@code .github/instructions/}.
     */
    static boolean isCopilotInstructions(Path file) {
        String name = RepoPaths.fileName(file).toLowerCase(Locale.ROOT);
        if (name.equals("copilot-instructions.md")) {
            return true;
        }
        return name.endsWith(".instructions.md")
                && RepoPaths.normalizedForMatch(file.toString()).contains(".github/instructions/");
    }

    private static boolean isAgentsOrClaude(Path file) {
        String name = RepoPaths.fileName(file).toLowerCase(Locale.ROOT);
        return name.equals("agents.md") || name.equals("claude.md");
    }
}
