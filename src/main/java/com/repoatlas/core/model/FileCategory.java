package com.repoatlas.core.model;

/**
 * Context tag assigned to every scanned file. Signal pattern groups declare which
 * categories they apply to, so frontend idioms are never reported from backend files.
 */
public enum FileCategory {
    FRONTEND,
    BACKEND,
    SHARED,
    STYLE,
    DOCS,
    CONFIG,
    OTHER;

    public boolean isCode() {
        return this == FRONTEND || this == BACKEND || this == SHARED;
    }
}
