package com.contextcatalog.engine.frontmatter;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Minimal reader for the YAML-style frontmatter that opens skill manifests
 * and rule files:
 * <pre>
 *   ---
 *   name: react-patterns
 *   description: "Component conventions for the web client"
 *   globs: ["src/**", "test/**"]
 *   ---
 * </pre>
 *
 * Only single-line {@code key: value} entries are understood. Anything this
 * reader cannot parse yields {@link Optional#empty()} rather than an error;
 * callers decide whether that excludes the file or merely leaves a field unset.
 */
public final class Frontmatter {

    // Block between the opening and closing --- markers, anchored at the very start of the file.
    private static final Pattern BLOCK = Pattern.compile("\\A---\\s*\\n(.*?)\\n---", Pattern.DOTALL);

    private Frontmatter() {}

    /** The text between the {@code ---} markers, or empty if the content has no frontmatter. */
    public static Optional<String> block(String content) {
        if (content == null) {
            return Optional.empty();
        }
        Matcher m = BLOCK.matcher(content);
        if (!m.find() || m.group(1).isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(m.group(1));
    }

    /**
     * Value of {@code key}, trimmed, with one pair of matching surrounding quotes removed.
     * Bracketed arrays such as {@code [a, b]} are returned verbatim.
     */
    public static Optional<String> value(String yaml, String key) {
        Matcher m = linePattern(key).matcher(yaml);
        if (!m.find()) {
            return Optional.empty();
        }
        String value = m.group(1).strip();
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\""))
                    || (value.startsWith("'") && value.endsWith("'")))) {
            value = value.substring(1, value.length() - 1);
        }
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /**
     * Value of {@code key} with optional leading and trailing quote characters stripped
     * independently, the lenient form used for skill names and descriptions.
     */
    public static Optional<String> looseValue(String yaml, String key) {
        Pattern p = Pattern.compile("^" + Pattern.quote(key) + ":\\s*[\"']?(.+?)[\"']?\\s*$", Pattern.MULTILINE);
        Matcher m = p.matcher(yaml);
        if (!m.find()) {
            return Optional.empty();
        }
        String value = m.group(1).strip();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    /** {@code true}/{@code false} (case-insensitive) for {@code key}; anything else is empty. */
    public static Optional<Boolean> booleanValue(String yaml, String key) {
        return value(yaml, key)
                .map(v -> v.toLowerCase(Locale.ROOT))
                .filter(v -> v.equals("true") || v.equals("false"))
                .map(Boolean::valueOf);
    }

    private static Pattern linePattern(String key) {
        return Pattern.compile("^" + Pattern.quote(key) + ":\\s*(.+)", Pattern.MULTILINE);
    }
}
