package com.repoatlas.core.graph;

import com.repoatlas.core.model.Edge;
import com.repoatlas.core.signals.RawReference;
import com.repoatlas.core.signals.Syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves raw import specifiers to known module paths. Resolution order is fixed:
 * exact relative path, then configured alias prefixes, then a same-directory fallback.
 * Anything else (external packages, URLs, builtins) stays unresolved.
 */
public class ReferenceResolver {

    static final List<String> SCRIPT_EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs", ".vue", ".svelte", ".json");

    public record Resolved(String path, Edge.Resolution resolution) {}

    private final Set<String> knownPaths;
    private final List<Map.Entry<String, String>> aliases;
    private final List<String> sourceRoots;

    public ReferenceResolver(Set<String> knownPaths, Map<String, String> aliases, List<String> sourceRoots) {
        this.knownPaths = knownPaths;
        // Longest prefix first so "@/lib/" beats "@/"
        this.aliases = aliases.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, String> e) -> e.getKey().length()).reversed()
                        .thenComparing(Map.Entry::getKey))
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .toList();
        this.sourceRoots = List.copyOf(sourceRoots);
    }

    public Optional<Resolved> resolve(String importer, RawReference reference, Syntax syntax) {
        String specifier = reference.specifier();
        if (specifier.isBlank()) {
            return Optional.empty();
        }
        return switch (syntax) {
            case SCRIPT -> resolveScript(importer, specifier);
            case PYTHON -> resolvePython(importer, specifier);
            case JAVA -> resolveJava(specifier);
            case NONE -> Optional.empty();
        };
    }

    private Optional<Resolved> resolveScript(String importer, String specifier) {
        if (specifier.startsWith("node:") || specifier.contains("://") || specifier.startsWith("data:")) {
            return Optional.empty();
        }
        String dir = directoryOf(importer);
        if (specifier.equals(".") || specifier.equals("..") || specifier.startsWith("./") || specifier.startsWith("../")) {
            return normalize(join(dir, specifier))
                    .flatMap(this::scriptCandidate)
                    .map(p -> new Resolved(p, Edge.Resolution.EXACT));
        }
        if (specifier.startsWith("/")) {
            return normalize(specifier.substring(1))
                    .flatMap(this::scriptCandidate)
                    .map(p -> new Resolved(p, Edge.Resolution.EXACT));
        }
        for (Map.Entry<String, String> alias : aliases) {
            if (specifier.startsWith(alias.getKey())) {
                Optional<String> hit = normalize(alias.getValue() + specifier.substring(alias.getKey().length()))
                        .flatMap(this::scriptCandidate);
                if (hit.isPresent()) {
                    return hit.map(p -> new Resolved(p, Edge.Resolution.ALIAS));
                }
            }
        }
        return normalize(join(dir, specifier))
                .flatMap(this::scriptCandidate)
                .map(p -> new Resolved(p, Edge.Resolution.SAME_DIRECTORY));
    }

    private Optional<Resolved> resolvePython(String importer, String specifier) {
        String dir = directoryOf(importer);
        if (specifier.startsWith(".")) {
            int dots = 0;
            while (dots < specifier.length() && specifier.charAt(dots) == '.') dots++;
            String base = dir;
            for (int i = 1; i < dots; i++) {
                if (base.isEmpty()) {
                    return Optional.empty();
                }
                base = directoryOf(base);
            }
            String rest = specifier.substring(dots).replace('.', '/');
            return pythonCandidate(join(base, rest)).map(p -> new Resolved(p, Edge.Resolution.EXACT));
        }
        String modulePath = specifier.replace('.', '/');
        for (String root : sourceRoots) {
            Optional<String> hit = pythonCandidate(join(root, modulePath));
            if (hit.isPresent()) {
                return hit.map(p -> new Resolved(p, Edge.Resolution.EXACT));
            }
        }
        return pythonCandidate(join(dir, modulePath)).map(p -> new Resolved(p, Edge.Resolution.SAME_DIRECTORY));
    }

    private Optional<Resolved> resolveJava(String qualifiedName) {
        Deque<String> segments = new ArrayDeque<>(List.of(qualifiedName.split("\\.")));
        // Static imports and nested classes name members below the file; trim until a file matches
        while (segments.size() >= 2) {
            String relative = String.join("/", segments) + ".java";
            for (String root : sourceRoots) {
                String candidate = join(root, relative);
                if (knownPaths.contains(candidate)) {
                    return Optional.of(new Resolved(candidate, Edge.Resolution.EXACT));
                }
            }
            segments.removeLast();
        }
        return Optional.empty();
    }

    private Optional<String> scriptCandidate(String base) {
        var candidates = new ArrayList<String>();
        candidates.add(base);
        // TypeScript sources are often imported with the emitted ".js" extension
        String stripped = stripScriptExtension(base);
        for (String ext : SCRIPT_EXTENSIONS) {
            candidates.add(stripped + ext);
        }
        for (String ext : SCRIPT_EXTENSIONS) {
            candidates.add(join(base, "index" + ext));
        }
        return firstKnown(candidates);
    }

    private Optional<String> pythonCandidate(String base) {
        if (base.isEmpty()) {
            return firstKnown(List.of("__init__.py"));
        }
        return firstKnown(List.of(base + ".py", base + "/__init__.py"));
    }

    private Optional<String> firstKnown(List<String> candidates) {
        for (String candidate : candidates) {
            if (knownPaths.contains(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static String stripScriptExtension(String base) {
        for (String ext : SCRIPT_EXTENSIONS) {
            if (base.endsWith(ext)) {
                return base.substring(0, base.length() - ext.length());
            }
        }
        return base;
    }

    static String directoryOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    static String join(String dir, String relative) {
        if (dir.isEmpty()) return relative;
        if (relative.isEmpty()) return dir;
        return dir + "/" + relative;
    }

    /**
     * Collapses {@code .} and {@code ..} segments; empty when the path climbs above the root.
     */
    static Optional<String> normalize(String path) {
        Deque<String> parts = new ArrayDeque<>();
        for (String part : path.split("/")) {
            if (part.isEmpty() || part.equals(".")) {
                continue;
            }
            if (part.equals("..")) {
                if (parts.isEmpty()) {
                    return Optional.empty();
                }
                parts.removeLast();
            } else {
                parts.addLast(part);
            }
        }
        return Optional.of(String.join("/", parts));
    }
}
