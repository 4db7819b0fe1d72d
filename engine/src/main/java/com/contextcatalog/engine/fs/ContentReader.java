package com.contextcatalog.engine.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads documentation files as text, leniently decoding UTF-8 and truncating
 * oversized files at a line boundary where possible.
 */
public final class ContentReader {

    private static final Logger log = LoggerFactory.getLogger(ContentReader.class);

    public static final String TRUNCATION_MARKER = "\n\n[Content truncated...]";

    /** A newline is only used as the cut point if it falls within the last 20% of the limit. */
    private static final double LINE_BOUNDARY_RATIO = 0.8;

    private ContentReader() {}

    /** Full content of {@code file}, or empty if it cannot be read. */
    public static Optional<String> read(Path file) {
        try {
            return Optional.of(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("Could not read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /** Content of {@code file} with surrounding whitespace removed, or empty if unreadable. */
    public static Optional<String> readTrimmed(Path file) {
        return read(file).map(ContentReader::trim);
    }

    /** Whitespace-trimmed text; a leading byte-order mark counts as whitespace. */
    public static String trim(String content) {
        String stripped = content.strip();
        if (stripped.startsWith("\uFEFF")) {
            return stripped.substring(1).strip();
        }
        return stripped;
    }

    /** Content of {@code file} truncated to {@code maxLength} characters, or empty if unreadable. */
    public static Optional<String> readWithLimit(Path file, int maxLength) {
        return read(file).map(content -> truncate(content, maxLength));
    }

    /**
     * Cut {@code content} to {@code maxLength} characters and append {@link #TRUNCATION_MARKER}.
     * Content within the limit is returned unchanged.
     */
    public static String truncate(String content, int maxLength) {
        if (content.length() <= maxLength) {
            return content;
        }
        String truncated = content.substring(0, maxLength);
        int lastNewline = truncated.lastIndexOf('\n');
        if (lastNewline > maxLength * LINE_BOUNDARY_RATIO) {
            return truncated.substring(0, lastNewline) + TRUNCATION_MARKER;
        }
        return truncated + TRUNCATION_MARKER;
    }
}
