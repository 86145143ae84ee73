package com.repoatlas.core.signals;

import com.repoatlas.core.model.Edge;

/**
 * An import-like statement as written in source, before resolution.
 */
public record RawReference(String specifier, Edge.Kind kind) {}
