package com.contextcatalog.engine.reference;

import com.contextcatalog.engine.fs.ContentReader;

import java.util.Locale;

/**
 * Detects when an AGENTS.md or CLAUDE.md file is nothing but an {@code @}
 * annotation pointing at its sibling, the convention used by agents that
 * only read one of the two file names:
 * <pre>
 *   AGENTS.md:  @CLAUDE.md
 *   CLAUDE.md:  # Build ... (real instructions)
 * </pre>
 *
 * Pure functions over file contents; no I/O, never throws.
 */
public final class CrossReferenceDetector {

    private static final String AGENTS_MD = "agents.md";
    private static final String CLAUDE_MD = "claude.md";

    /** Which member of a colocated AGENTS.md/CLAUDE.md pair. */
    public enum PairMember { AGENTS, CLAUDE }

    /**
     * @param isReference    true if the whole content is a single {@code @file} annotation
     * @param referencedFile the referenced file name as written (without {@code @} or {@code ./}), or null
     */
    public record FileReference(boolean isReference, String referencedFile) {

        static final FileReference NONE = new FileReference(false, null);

        boolean pointsTo(String fileName) {
            return isReference && referencedFile != null
                    && referencedFile.toLowerCase(Locale.ROOT).equals(fileName);
        }
    }

    /**
     * @param hasReference  true if one file of the pair is a pointer to the other
     * @param referenceFile the pointer, or null
     * @param contentFile   the file holding the real content, or null
     */
    public record CrossReference(boolean hasReference, PairMember referenceFile, PairMember contentFile) {

        static final CrossReference NONE = new CrossReference(false, null, null);
    }

    private CrossReferenceDetector() {}

    /**
     * Matches {@code @CLAUDE.md}, {@code @AGENTS.md}, {@code @./CLAUDE.md}, {@code @./AGENTS.md}
     * (case-insensitive, surrounding whitespace allowed). Any other content, including a
     * reference into a parent or child directory, is not a reference.
     */
    public static FileReference isFileReference(String content) {
        if (content == null) {
            return FileReference.NONE;
        }
        String trimmed = ContentReader.trim(content);
        if (trimmed.isEmpty() || !trimmed.startsWith("@")) {
            return FileReference.NONE;
        }

        String referenced = trimmed.substring(1);
        if (referenced.startsWith("./")) {
            referenced = referenced.substring(2);
        }
        if (referenced.contains("/") || referenced.contains("\\")) {
            return FileReference.NONE;
        }

        String lower = referenced.toLowerCase(Locale.ROOT);
        if (lower.equals(AGENTS_MD) || lower.equals(CLAUDE_MD)) {
            return new FileReference(true, referenced);
        }
        return FileReference.NONE;
    }

    /**
     * Decide whether one file of a colocated pair merely points at the other.
     * AGENTS.md pointing at CLAUDE.md takes priority; self-references do not count.
     */
    public static CrossReference detectCrossReference(String agentsContent, String claudeContent) {
        if (isFileReference(agentsContent).pointsTo(CLAUDE_MD)) {
            return new CrossReference(true, PairMember.AGENTS, PairMember.CLAUDE);
        }
        if (isFileReference(claudeContent).pointsTo(AGENTS_MD)) {
            return new CrossReference(true, PairMember.CLAUDE, PairMember.AGENTS);
        }
        return CrossReference.NONE;
    }
}
