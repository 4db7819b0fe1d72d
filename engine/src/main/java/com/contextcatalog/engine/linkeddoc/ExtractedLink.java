package com.contextcatalog.engine.linkeddoc;

import java.nio.file.Path;

/**
 * A Markdown link to a {@code .md} file found in a context file.
 *
 * @param rawPath      target as written, anchor removed, not resolved
 * @param absolutePath target resolved against the directory of {@code sourcePath}
 * @param linkText     link label
 * @param sourcePath   absolute path of the file containing the link
 */
public record ExtractedLink(String rawPath, Path absolutePath, String linkText, Path sourcePath) {}
