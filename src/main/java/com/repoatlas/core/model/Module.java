package com.repoatlas.core.model;

/**
 * Canonical identity of one source file in the dependency graph.
 *
 * @param path        normalized root-relative path, always {@code /}-separated
 * @param logicalName boundary grouping; top-level files share the synthetic {@value #ROOT} name
 * @param category    context tag derived from extension and location
 * @param language    language key, e.g. {@code "typescript"} or {@code "python"}
 * @param lines       total line count of the file
 * @param barrel      true when the file only re-exports other modules
 */
public record Module(
        String path,
        String logicalName,
        FileCategory category,
        String language,
        int lines,
        boolean barrel
) {
    public static final String ROOT = "root";

    /** Parent directory of this module, empty for top-level files. */
    public String directory() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    /** File name without directories. */
    public String fileName() {
        return path.substring(path.lastIndexOf('/') + 1);
    }
}
