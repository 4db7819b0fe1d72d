package com.contextcatalog.engine.fs;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.Locale;
import java.util.function.Function;

/**
 * Path helpers shared by every discovery step.
 *
 * Repo-relative paths are always rendered with {@code /} separators so that
 * catalogs look the same on every platform.
 */
public final class RepoPaths {

    private RepoPaths() {}

    /**
     * Path of {@code file} relative to {@code baseDir}, or the absolute path
     * if the file does not live under the base directory.
     */
    public static String relativize(Path baseDir, Path file) {
        Path base = baseDir.toAbsolutePath().normalize();
        Path target = file.toAbsolutePath().normalize();
        if (!target.startsWith(base)) {
            return toSlashes(target.toString());
        }
        return toSlashes(base.relativize(target).toString());
    }

    /** Directory depth of a repo-relative path: {@code AGENTS.md} is 0, {@code a/AGENTS.md} is 1. */
    public static int depth(String relativePath) {
        return relativePath.split("/", -1).length - 1;
    }

    /** Depth of {@code file} below {@code baseDir}. */
    public static int depth(Path baseDir, Path file) {
        return depth(relativize(baseDir, file));
    }

    /** Lower-cased, {@code /}-separated form used for case-insensitive matching. */
    public static String normalizedForMatch(String path) {
        return toSlashes(path).toLowerCase(Locale.ROOT);
    }

    /** Shallower first; ties keep their encounter order when used with a stable sort. */
    public static <T> Comparator<T> byDepth(Function<T, String> pathOf) {
        return Comparator.comparingInt(item -> depth(pathOf.apply(item)));
    }

    public static String fileName(Path file) {
        Path name = file.getFileName();
        return name == null ? "" : name.toString();
    }

    private static String toSlashes(String path) {
        return path.replace('\\', '/');
    }
}
