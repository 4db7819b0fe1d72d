package com.contextcatalog.engine.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Read-only repository traversal used by every discovery step.
 *
 * Behaves like a case-insensitive glob with hidden directories included:
 * <ul>
 *   <li>directory symlinks are not followed (file symlinks are reported as-is
 *       so the locator can resolve them);</li>
 *   <li>build output, dependency and VCS directories are pruned;</li>
 *   <li>unreadable subdirectories are skipped, but an unreadable root is fatal.</li>
 * </ul>
 */
@Component
public class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    static final Set<String> IGNORED_DIRECTORIES = Set.of(
            "node_modules", "dist", "build", ".git", "vendor", "coverage");

    /**
     * Find every file under {@code baseDir} matching {@code pattern}.
     *
     * @return absolute paths, lexicographically sorted
     * @throws ScanException if {@code baseDir} is missing, not a directory, or cannot be walked
     */
    public List<Path> scan(Path baseDir, ScanPattern pattern) {
        Path root = requireDirectory(baseDir);
        List<Path> matches = new ArrayList<>();

        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (!dir.equals(root)
                            && IGNORED_DIRECTORIES.contains(RepoPaths.fileName(dir).toLowerCase(Locale.ROOT))) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isDirectory()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String relative = RepoPaths.normalizedForMatch(root.relativize(file).toString());
                    if (pattern.matches(Arrays.asList(relative.split("/")))) {
                        matches.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    if (file.equals(root)) {
                        throw new ScanException("Cannot traverse repository root " + root, e);
                    }
                    log.debug("Skipping unreadable path {}: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new ScanException("Failed to scan " + root + " for " + pattern, e);
        }

        matches.sort(null);
        log.debug("Scan {} under {} matched {} file(s)", pattern, root, matches.size());
        return matches;
    }

    /**
     * Drop files whose depth below {@code baseDir} exceeds {@code maxDepth}.
     * A {@code null} maxDepth means unlimited.
     */
    public static List<Path> withinDepth(Path baseDir, List<Path> files, Integer maxDepth) {
        if (maxDepth == null) {
            return files;
        }
        return files.stream()
                .filter(file -> RepoPaths.depth(baseDir, file) <= maxDepth)
                .toList();
    }

    static Path requireDirectory(Path baseDir) {
        if (baseDir == null) {
            throw new ScanException("Repository root must not be null");
        }
        Path root = baseDir.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new ScanException("Repository root does not exist or is not a directory: " + root);
        }
        return root;
    }
}
