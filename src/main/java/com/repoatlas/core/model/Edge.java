package com.repoatlas.core.model;

/**
 * Directed dependency: {@code from} references {@code to}. Both ends are module paths.
 */
public record Edge(String from, String to, Kind kind, Resolution resolution) {

    public Edge {
        if (from.equals(to)) {
            throw new IllegalArgumentException("Self-edge is not allowed: " + from);
        }
    }

    public enum Kind { REFERENCE, REEXPORT }

    /** Which resolution step produced the edge. */
    public enum Resolution { EXACT, ALIAS, SAME_DIRECTORY }
}
