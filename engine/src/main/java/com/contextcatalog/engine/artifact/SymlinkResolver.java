package com.contextcatalog.engine.artifact;

import com.contextcatalog.engine.artifact.CanonicalCheck.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.FileSystemLoopException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses discovered files that share a canonical filesystem target
 * (symlinks, symlink chains, hard links, the same file matched by two patterns).
 *
 * Targets are identified by their file key (device and inode) where the
 * filesystem provides one, and by their real path otherwise.
 *
 * The first file seen for a target wins. Problem symlinks are skipped and
 * logged; files whose link status cannot even be checked are kept.
 */
final class SymlinkResolver {

    private static final Logger log = LoggerFactory.getLogger(SymlinkResolver.class);

    private SymlinkResolver() {}

    /**
     * Resolve every file and keep one per canonical target, in encounter order.
     * The canonical map is local to this call.
     */
    static List<Path> resolve(List<Path> files) {
        Map<Object, Path> firstSeen = new HashMap<>();
        List<Path> result = new ArrayList<>();
        for (Path file : files) {
            CanonicalCheck check = check(file, firstSeen);
            if (check.kept()) {
                result.add(file);
            }
        }
        return result;
    }

    /**
     * Decide whether {@code file} is kept, registering its target in
     * {@code firstSeen} (target identity → first discovered file) when it is.
     */
    static CanonicalCheck check(Path file, Map<Object, Path> firstSeen) {
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(file, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            log.debug("Could not check link status of {}, keeping it: {}", file, e.getMessage());
            return new CanonicalCheck(file, Outcome.UNCHECKED, null);
        }

        if (!attrs.isSymbolicLink()) {
            Path canonical;
            try {
                canonical = file.toRealPath();
            } catch (IOException e) {
                log.debug("Could not resolve {}, keeping it: {}", file, e.getMessage());
                return new CanonicalCheck(file, Outcome.UNCHECKED, null);
            }
            return claim(file, canonical, identity(canonical, attrs), firstSeen);
        }

        try {
            Path canonical = file.toRealPath();
            CanonicalCheck check = claim(file, canonical, identity(canonical), firstSeen);
            if (check.kept()) {
                log.debug("Symlink: {} -> {}", file, canonical);
            }
            return check;
        } catch (NoSuchFileException e) {
            log.warn("Broken symlink: {} (target not found)", file);
            return new CanonicalCheck(file, Outcome.BROKEN, null);
        } catch (AccessDeniedException e) {
            log.warn("Permission denied for symlink: {}", file);
            return new CanonicalCheck(file, Outcome.ACCESS_DENIED, null);
        } catch (IOException e) {
            if (isLoop(e)) {
                log.warn("Circular symlink detected: {}", file);
                return new CanonicalCheck(file, Outcome.CIRCULAR, null);
            }
            log.warn("Error resolving symlink {}: {}", file, e.getMessage());
            return new CanonicalCheck(file, Outcome.UNRESOLVABLE, null);
        }
    }

    private static CanonicalCheck claim(Path file, Path canonical, Object identity, Map<Object, Path> firstSeen) {
        Path existing = firstSeen.putIfAbsent(identity, file);
        if (existing != null) {
            log.debug("Deduplicated: {} (same target as {})", file, existing);
            return new CanonicalCheck(file, Outcome.DUPLICATE, canonical);
        }
        return new CanonicalCheck(file, Outcome.KEPT, canonical);
    }

    private static Object identity(Path canonical) {
        try {
            return identity(canonical, Files.readAttributes(canonical, BasicFileAttributes.class));
        } catch (IOException e) {
            log.debug("Could not read attributes of {}, using its path: {}", canonical, e.getMessage());
            return canonical;
        }
    }

    private static Object identity(Path canonical, BasicFileAttributes attrs) {
        Object key = attrs.fileKey();
        return key != null ? key : canonical;
    }

    // realpath(3) reports ELOOP as a plain FileSystemException with the errno text as reason.
    private static boolean isLoop(IOException e) {
        if (e instanceof FileSystemLoopException) {
            return true;
        }
        if (e instanceof FileSystemException) {
            String reason = ((FileSystemException) e).getReason();
            return reason != null && reason.contains("Too many levels of symbolic links");
        }
        return false;
    }
}
