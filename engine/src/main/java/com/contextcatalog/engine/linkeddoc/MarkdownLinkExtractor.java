package com.contextcatalog.engine.linkeddoc;

import com.contextcatalog.engine.fs.RepoPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts links to local Markdown documents from a context file.
 *
 * Understands inline links {@code [text](docs/setup.md#install)} and reference
 * definitions {@code [setup]: docs/setup.md} on a line of their own. Inline links
 * are reported first, each group in document order. External URLs, anchor-only
 * links and links to other context files are ignored.
 */
public final class MarkdownLinkExtractor {

    private static final Logger log = LoggerFactory.getLogger(MarkdownLinkExtractor.class);

    private static final Pattern INLINE_LINK = Pattern.compile(
            "\\[([^\\]]+)\\]\\(([^)]+\\.md(?:#[^)]*)?)\\)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern REFERENCE_DEFINITION = Pattern.compile(
            "^\\[([^\\]]+)\\]:\\s*(\\S+\\.md(?:#\\S*)?)\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private MarkdownLinkExtractor() {}

    /**
     * @param sourcePath absolute path of the file {@code content} was read from
     * @return links in extraction order, at most one per resolved target
     */
    public static List<ExtractedLink> extract(String content, Path sourcePath) {
        Path sourceDir = sourcePath.toAbsolutePath().getParent();
        Set<Path> seen = new HashSet<>();
        List<ExtractedLink> links = new ArrayList<>();

        collect(INLINE_LINK.matcher(content), sourcePath, sourceDir, seen, links);
        collect(REFERENCE_DEFINITION.matcher(content), sourcePath, sourceDir, seen, links);
        return links;
    }

    private static void collect(Matcher m, Path sourcePath, Path sourceDir,
                                Set<Path> seen, List<ExtractedLink> links) {
        while (m.find()) {
            String linkText = m.group(1);
            String target = m.group(2);
            if (target.isEmpty() || isExternal(target) || target.startsWith("#")) {
                continue;
            }

            String rawPath = removeAnchor(target);
            if (isContextFile(rawPath)) {
                continue;
            }

            Path absolute;
            try {
                Path candidate = Path.of(rawPath);
                absolute = candidate.isAbsolute()
                        ? candidate.normalize()
                        : sourceDir.resolve(candidate).normalize();
            } catch (InvalidPathException e) {
                log.debug("Ignoring unusable link target '{}' in {}: {}", rawPath, sourcePath, e.getMessage());
                continue;
            }

            if (seen.add(absolute)) {
                links.add(new ExtractedLink(rawPath, absolute, linkText, sourcePath));
            }
        }
    }

    static boolean isExternal(String target) {
        return target.startsWith("http://") || target.startsWith("https://") || target.startsWith("//");
    }

    static String removeAnchor(String target) {
        int hash = target.indexOf('#');
        return hash < 0 ? target : target.substring(0, hash);
    }

    /**
     * Links to AGENTS.md, CLAUDE.md, copilot-instructions.md or a scoped
     * {@code .github/instructions/*.instructions.md} file point at context the
     * locator already collects.
     */
    static boolean isContextFile(String path) {
        String normalized = RepoPaths.normalizedForMatch(path);
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        if (fileName.equals("agents.md") || fileName.equals("claude.md")
                || fileName.equals("copilot-instructions.md")) {
            return true;
        }
        return fileName.endsWith(".instructions.md") && normalized.contains(".github/instructions/");
    }
}
