package com.repoatlas.core.signals;

import com.repoatlas.core.model.FileCategory;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Assigns the {@link FileCategory} context tag, language key and {@link Syntax}
 * from a file's extension and location.
 */
public final class FileCategorizer {

    private static final Set<String> STYLE_EXTENSIONS = Set.of(".css", ".scss", ".sass", ".less", ".styl", ".pcss");
    private static final Set<String> DOC_EXTENSIONS = Set.of(".md", ".txt", ".rst");
    private static final Set<String> CONFIG_EXTENSIONS = Set.of(".json", ".yml", ".yaml", ".toml");
    private static final Set<String> FRONTEND_EXTENSIONS = Set.of(".jsx", ".tsx", ".vue", ".svelte");
    private static final Set<String> BACKEND_EXTENSIONS = Set.of(".py", ".java", ".kt", ".go", ".rb", ".php");
    private static final Set<String> SCRIPT_EXTENSIONS = Set.of(".js", ".ts", ".mjs", ".cjs");

    private static final Set<String> FRONTEND_DIRS = Set.of(
            "components", "pages", "hooks", "store", "stores", "client", "frontend", "web", "ui", "views");
    private static final Set<String> BACKEND_DIRS = Set.of(
            "server", "backend", "api", "routes", "controllers", "models", "services",
            "middleware", "middlewares", "repositories", "repository", "db", "migrations");

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry(".js", "javascript"), Map.entry(".jsx", "javascript"),
            Map.entry(".mjs", "javascript"), Map.entry(".cjs", "javascript"),
            Map.entry(".ts", "typescript"), Map.entry(".tsx", "typescript"),
            Map.entry(".vue", "vue"), Map.entry(".svelte", "svelte"),
            Map.entry(".py", "python"), Map.entry(".java", "java"), Map.entry(".kt", "kotlin"),
            Map.entry(".go", "go"), Map.entry(".rb", "ruby"), Map.entry(".php", "php")
    );

    private FileCategorizer() {} // utility class

    public static FileCategory categorize(String relativePath, String extension) {
        if (STYLE_EXTENSIONS.contains(extension)) return FileCategory.STYLE;
        if (DOC_EXTENSIONS.contains(extension)) return FileCategory.DOCS;
        if (CONFIG_EXTENSIONS.contains(extension)) return FileCategory.CONFIG;
        if (FRONTEND_EXTENSIONS.contains(extension)) return FileCategory.FRONTEND;
        if (BACKEND_EXTENSIONS.contains(extension)) return FileCategory.BACKEND;
        if (!SCRIPT_EXTENSIONS.contains(extension)) return FileCategory.OTHER;

        // Plain JS/TS: the deepest recognisable directory decides
        String[] parts = relativePath.toLowerCase(Locale.ROOT).split("/");
        for (int i = parts.length - 2; i >= 0; i--) {
            if (FRONTEND_DIRS.contains(parts[i])) return FileCategory.FRONTEND;
            if (BACKEND_DIRS.contains(parts[i])) return FileCategory.BACKEND;
        }
        return FileCategory.SHARED;
    }

    public static String language(String extension) {
        return LANGUAGES.getOrDefault(extension, extension.isEmpty() ? "unknown" : extension.substring(1));
    }

    public static Syntax syntax(String extension) {
        if (SCRIPT_EXTENSIONS.contains(extension) || FRONTEND_EXTENSIONS.contains(extension)) return Syntax.SCRIPT;
        if (".py".equals(extension)) return Syntax.PYTHON;
        if (".java".equals(extension)) return Syntax.JAVA;
        return Syntax.NONE;
    }

    public static boolean isStyle(String extension) {
        return STYLE_EXTENSIONS.contains(extension);
    }
}
