package com.repoatlas.core.vcs;

import java.util.List;

/**
 * Files changed according to version control, with where they came from.
 */
public record ChangeSet(Source source, List<String> files) {

    public enum Source {
        /** Supplied by the caller. */
        EXPLICIT,
        STAGED,
        UNSTAGED,
        LAST_COMMIT,
        /** Inside a work tree but nothing changed. */
        NONE,
        /** Not a git work tree, or git is unavailable. */
        NO_VCS
    }

    public ChangeSet {
        files = List.copyOf(files);
    }

    public static ChangeSet explicit(List<String> files) {
        return new ChangeSet(Source.EXPLICIT, files);
    }
}
