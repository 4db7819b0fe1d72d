package com.contextcatalog.engine.artifact;

import com.contextcatalog.engine.fs.ContentReader;
import com.contextcatalog.engine.fs.RepoPaths;
import com.contextcatalog.engine.fs.RepositoryScanner;
import com.contextcatalog.engine.fs.ScanException;
import com.contextcatalog.engine.fs.ScanPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Finds and loads the context files of a repository: AGENTS.md, CLAUDE.md,
 * Copilot instructions and Claude rules.
 *
 * <p>Discovery pipeline:
 * <ol>
 *   <li>five pattern scans, run concurrently, concatenated in a fixed order</li>
 *   <li>depth filter</li>
 *   <li>symlink resolution: one file per canonical target</li>
 *   <li>directory-local AGENTS.md/CLAUDE.md deduplication</li>
 *   <li>global Copilot instructions deduplication</li>
 *   <li>stable sort by depth, shallowest first</li>
 * </ol>
 *
 * Only a missing or unwalkable repository root raises ({@link ScanException});
 * every per-file problem is logged and handled locally.
 */
@Component
public class ContextArtifactLocator {

    private static final Logger log = LoggerFactory.getLogger(ContextArtifactLocator.class);

    private static final List<ScanPattern> CONTEXT_PATTERNS = List.of(
            ScanPattern.AGENTS,
            ScanPattern.CLAUDE,
            ScanPattern.COPILOT_INSTRUCTIONS,
            ScanPattern.SCOPED_INSTRUCTIONS,
            ScanPattern.CLAUDE_RULES
    );

    private final RepositoryScanner scanner;
    private final int maxContentLength;

    public ContextArtifactLocator(
            RepositoryScanner scanner,
            @Value("${catalog.context.max-content-length:50000}") int maxContentLength) {
        this.scanner          = scanner;
        this.maxContentLength = maxContentLength;
    }

    // ------------------------------------------------------------------
    // Discovery
    // ------------------------------------------------------------------

    /**
     * Discover context files under {@code baseDir}.
     *
     * @param maxDepth deepest directory level to include (root = 0); null for unlimited
     * @return absolute paths, shallowest first
     */
    public List<Path> findContextFiles(Path baseDir, Integer maxDepth) {
        List<Path> found = scanAll(baseDir);
        List<Path> inDepth = RepositoryScanner.withinDepth(baseDir, found, maxDepth);

        List<Path> resolved = SymlinkResolver.resolve(inDepth);
        List<Path> colocated = ContextFileDeduplicator.deduplicateColocated(resolved);
        List<Path> unique = ContextFileDeduplicator.deduplicateCopilotInstructions(colocated);

        List<Path> sorted = new ArrayList<>(unique);
        sorted.sort(RepoPaths.byDepth(file -> RepoPaths.relativize(baseDir, file)));

        log.debug("Found {} context file(s) under {} ({} before deduplication)",
                sorted.size(), baseDir, inDepth.size());
        return sorted;
    }

    /** Discover and load in one step, with the configured content limit. */
    public List<ContextArtifact> locate(Path baseDir, Integer maxDepth) {
        List<Path> files = findContextFiles(baseDir, maxDepth);
        return loadArtifacts(files, baseDir, maxContentLength).artifacts();
    }

    /**
     * Resolve {@code file} against the targets already claimed in {@code seen}, keyed
     * by file key where available and by real path otherwise. Kept files register
     * their target; see {@link CanonicalCheck.Outcome} for the rest.
     */
    public CanonicalCheck resolveCanonical(Path file, Map<Object, Path> seen) {
        return SymlinkResolver.check(file, seen);
    }

    /** Compare one colocated AGENTS.md/CLAUDE.md pair. */
    public PairDecision decidePair(Path agentsFile, Path claudeFile) {
        return ContextFileDeduplicator.decidePair(agentsFile, claudeFile);
    }

    /**
     * Directories holding both an AGENTS.md and a CLAUDE.md, before any
     * deduplication. Used for reporting.
     */
    public List<ColocatedPair> findColocatedPairs(Path baseDir, Integer maxDepth) {
        List<Path> candidates = new ArrayList<>(scanner.scan(baseDir, ScanPattern.AGENTS));
        candidates.addAll(scanner.scan(baseDir, ScanPattern.CLAUDE));
        candidates = RepositoryScanner.withinDepth(baseDir, candidates, maxDepth);

        Map<Path, Path[]> byDirectory = new LinkedHashMap<>();
        for (Path file : candidates) {
            Path[] slots = byDirectory.computeIfAbsent(file.getParent(), dir -> new Path[2]);
            String name = RepoPaths.fileName(file).toLowerCase(Locale.ROOT);
            if (name.equals("agents.md")) {
                slots[0] = file;
            } else if (name.equals("claude.md")) {
                slots[1] = file;
            }
        }

        List<ColocatedPair> pairs = new ArrayList<>();
        byDirectory.forEach((dir, slots) -> {
            if (slots[0] != null && slots[1] != null) {
                pairs.add(new ColocatedPair(dir, slots[0], slots[1]));
            }
        });
        return pairs;
    }

    // ------------------------------------------------------------------
    // Loading
    // ------------------------------------------------------------------

    /**
     * Read each file into a {@link ContextArtifact}. Unreadable files are skipped;
     * content beyond {@code maxLength} characters is truncated. Artifacts come back
     * shallowest first.
     */
    public ArtifactLoadResult loadArtifacts(List<Path> files, Path baseDir, int maxLength) {
        List<ContextArtifact> artifacts = new ArrayList<>();
        for (Path file : files) {
            Optional<String> content = ContentReader.readWithLimit(file, maxLength);
            if (content.isEmpty()) {
                continue;
            }
            String relative = RepoPaths.relativize(baseDir, file);
            ArtifactType type = ArtifactType.of(relative);
            artifacts.add(ContextArtifact.of(relative, type, content.get(),
                    RuleMetadata.from(type, content.get())));
        }
        artifacts.sort(RepoPaths.byDepth(ContextArtifact::path));
        return new ArtifactLoadResult(artifacts, files.size());
    }

    public int maxContentLength() {
        return maxContentLength;
    }

    // ------------------------------------------------------------------
    // Internals
    // ------------------------------------------------------------------

    private List<Path> scanAll(Path baseDir) {
        ExecutorService pool = Executors.newFixedThreadPool(CONTEXT_PATTERNS.size());
        try {
            List<CompletableFuture<List<Path>>> scans = CONTEXT_PATTERNS.stream()
                    .map(pattern -> CompletableFuture.supplyAsync(() -> scanner.scan(baseDir, pattern), pool))
                    .toList();

            List<Path> all = new ArrayList<>();
            for (CompletableFuture<List<Path>> scan : scans) {
                all.addAll(scan.join());
            }
            return all;
        } catch (CompletionException e) {
            if (e.getCause() instanceof ScanException) {
                throw (ScanException) e.getCause();
            }
            throw new ScanException("Context file scan failed under " + baseDir, e.getCause());
        } finally {
            pool.shutdown();
        }
    }
}
