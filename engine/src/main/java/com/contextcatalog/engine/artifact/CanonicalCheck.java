package com.contextcatalog.engine.artifact;

import java.nio.file.Path;

/**
 * Outcome of resolving one discovered file to its canonical filesystem target.
 *
 * @param path      the file as discovered
 * @param outcome   keep/drop decision and the reason for it
 * @param canonical resolved target, or null if it could not be determined
 */
public record CanonicalCheck(Path path, Outcome outcome, Path canonical) {

    public enum Outcome {
        /** First file seen for this canonical target. */
        KEPT(true),
        /** Another file already claimed the same canonical target. */
        DUPLICATE(false),
        /** Symlink chain loops back on itself. */
        CIRCULAR(false),
        /** Symlink target does not exist. */
        BROKEN(false),
        /** Symlink target cannot be accessed. */
        ACCESS_DENIED(false),
        /** Symlink could not be resolved for another reason. */
        UNRESOLVABLE(false),
        /** Link status could not be checked; kept without canonical tracking. */
        UNCHECKED(true);

        private final boolean kept;

        Outcome(boolean kept) {
            this.kept = kept;
        }

        public boolean kept() {
            return kept;
        }
    }

    public boolean kept() {
        return outcome.kept();
    }
}
