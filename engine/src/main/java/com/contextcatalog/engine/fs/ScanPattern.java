package com.contextcatalog.engine.fs;

import java.util.List;

/**
 * The file patterns the engine discovers, matched case-insensitively against
 * the repo-relative path split into segments (last segment = file name).
 *
 * <pre>
 *   AGENTS               **&#47;AGENTS.md
 *   CLAUDE               **&#47;CLAUDE.md
 *   COPILOT_INSTRUCTIONS **&#47;.github/**&#47;copilot-instructions.md
 *   SCOPED_INSTRUCTIONS  **&#47;.github/instructions/**&#47;*.instructions.md
 *   CLAUDE_RULES         **&#47;.claude/rules/**&#47;*.md   (no hidden dirs below rules/)
 *   SKILL                **&#47;SKILL.md
 * </pre>
 */
public enum ScanPattern {

    AGENTS {
        @Override
        boolean matches(List<String> segments) {
            return fileName(segments).equals("agents.md");
        }
    },

    CLAUDE {
        @Override
        boolean matches(List<String> segments) {
            return fileName(segments).equals("claude.md");
        }
    },

    COPILOT_INSTRUCTIONS {
        @Override
        boolean matches(List<String> segments) {
            return fileName(segments).equals("copilot-instructions.md")
                    && directories(segments).contains(".github");
        }
    },

    SCOPED_INSTRUCTIONS {
        @Override
        boolean matches(List<String> segments) {
            return fileName(segments).endsWith(".instructions.md")
                    && indexOfPair(directories(segments), ".github", "instructions") >= 0;
        }
    },

    CLAUDE_RULES {
        @Override
        boolean matches(List<String> segments) {
            if (!fileName(segments).endsWith(".md")) {
                return false;
            }
            List<String> dirs = directories(segments);
            int rules = indexOfPair(dirs, ".claude", "rules");
            if (rules < 0) {
                return false;
            }
            // .claude/rules/.archived/old.md and the like are not live rules
            for (String dir : dirs.subList(rules + 2, dirs.size())) {
                if (dir.startsWith(".")) {
                    return false;
                }
            }
            return true;
        }
    },

    SKILL {
        @Override
        boolean matches(List<String> segments) {
            return fileName(segments).equals("skill.md");
        }
    };

    /**
     * @param segments lower-cased repo-relative path segments
     */
    abstract boolean matches(List<String> segments);

    private static String fileName(List<String> segments) {
        return segments.isEmpty() ? "" : segments.get(segments.size() - 1);
    }

    private static List<String> directories(List<String> segments) {
        return segments.subList(0, Math.max(0, segments.size() - 1));
    }

    /** Index of the first occurrence of {@code first} immediately followed by {@code second}, or -1. */
    private static int indexOfPair(List<String> dirs, String first, String second) {
        for (int i = 0; i + 1 < dirs.size(); i++) {
            if (dirs.get(i).equals(first) && dirs.get(i + 1).equals(second)) {
                return i;
            }
        }
        return -1;
    }
}
