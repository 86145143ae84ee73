package com.repoatlas.core.model;

/**
 * A route registration found in a source file, e.g. {@code router.get('/users', list)}.
 */
public record RouteEntry(String method, String path, String handler, String file) {}
