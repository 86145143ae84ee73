package com.repoatlas.core.graph;

import com.repoatlas.core.model.Module;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps a file path to its logical boundary name.
 */
public final class ModuleNaming {

    /** Directory names that mark a boundary wherever they appear. */
    private static final List<String> BOUNDARY_HINTS = List.of(
            "controllers", "services", "models", "utils", "routes", "middlewares", "middleware",
            "config", "repositories", "repository", "hooks", "store", "stores", "pages", "components");

    /** Top-level directories that only contain the real boundaries. */
    private static final Set<String> SOURCE_CONTAINERS = Set.of("src", "app", "server", "backend", "frontend", "lib");

    private ModuleNaming() {} // utility class

    public static String logicalName(String path) {
        String[] parts = path.split("/");
        if (parts.length == 1) {
            return Module.ROOT;
        }
        for (int i = 0; i < parts.length - 1; i++) {
            if (BOUNDARY_HINTS.contains(parts[i].toLowerCase(Locale.ROOT))) {
                return parts[i];
            }
        }
        if (SOURCE_CONTAINERS.contains(parts[0].toLowerCase(Locale.ROOT)) && parts.length > 2) {
            return parts[1];
        }
        return parts[0];
    }
}
