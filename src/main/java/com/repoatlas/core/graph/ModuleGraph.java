package com.repoatlas.core.graph;

import com.repoatlas.core.model.Edge;
import com.repoatlas.core.model.Module;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable file-level dependency graph. Every edge endpoint is a known module, there
 * are no self-edges and at most one edge per ordered pair.
 */
public class ModuleGraph {

    private final SortedMap<String, Module> modules;
    private final List<Edge> edges;
    private final SortedMap<String, SortedSet<String>> dependencies = new TreeMap<>();
    private final SortedMap<String, SortedSet<String>> dependents = new TreeMap<>();
    private final int unresolvedCount;
    private final List<String> unresolvedSample;

    public ModuleGraph(Collection<Module> modules, Collection<Edge> edges, int unresolvedCount, List<String> unresolvedSample) {
        var byPath = new TreeMap<String, Module>();
        for (Module module : modules) {
            byPath.put(module.path(), module);
            dependencies.put(module.path(), new TreeSet<>());
            dependents.put(module.path(), new TreeSet<>());
        }
        this.modules = Collections.unmodifiableSortedMap(byPath);
        for (Edge edge : edges) {
            if (!byPath.containsKey(edge.from()) || !byPath.containsKey(edge.to())) {
                throw new IllegalArgumentException("Edge endpoint not in module set: " + edge);
            }
            dependencies.get(edge.from()).add(edge.to());
            dependents.get(edge.to()).add(edge.from());
        }
        this.edges = edges.stream()
                .sorted((a, b) -> a.from().equals(b.from()) ? a.to().compareTo(b.to()) : a.from().compareTo(b.from()))
                .toList();
        this.unresolvedCount = unresolvedCount;
        this.unresolvedSample = List.copyOf(unresolvedSample);
    }

    public SortedMap<String, Module> modules() {
        return modules;
    }

    public Module module(String path) {
        return modules.get(path);
    }

    public boolean contains(String path) {
        return modules.containsKey(path);
    }

    public List<Edge> edges() {
        return edges;
    }

    /** Modules that {@code path} references. */
    public SortedSet<String> dependenciesOf(String path) {
        return Collections.unmodifiableSortedSet(dependencies.getOrDefault(path, new TreeSet<>()));
    }

    /** Modules that reference {@code path}. */
    public SortedSet<String> dependentsOf(String path) {
        return Collections.unmodifiableSortedSet(dependents.getOrDefault(path, new TreeSet<>()));
    }

    public SortedMap<String, SortedSet<String>> adjacency() {
        return Collections.unmodifiableSortedMap(dependencies);
    }

    public int unresolvedCount() {
        return unresolvedCount;
    }

    public List<String> unresolvedSample() {
        return unresolvedSample;
    }

    /**
     * Collapses file edges onto logical module names. Edges inside one logical module
     * disappear; every logical module appears as a key.
     */
    public SortedMap<String, SortedSet<String>> boundaryGraph() {
        var boundary = new TreeMap<String, SortedSet<String>>();
        for (Module module : modules.values()) {
            boundary.computeIfAbsent(module.logicalName(), k -> new TreeSet<>());
        }
        for (Edge edge : edges) {
            String from = modules.get(edge.from()).logicalName();
            String to = modules.get(edge.to()).logicalName();
            if (!from.equals(to)) {
                boundary.get(from).add(to);
            }
        }
        return boundary;
    }

    /** Reverse of {@link #boundaryGraph()}. */
    public SortedMap<String, SortedSet<String>> boundaryDependents() {
        var reverse = new TreeMap<String, SortedSet<String>>();
        for (Map.Entry<String, SortedSet<String>> entry : boundaryGraph().entrySet()) {
            reverse.computeIfAbsent(entry.getKey(), k -> new TreeSet<>());
            for (String target : entry.getValue()) {
                reverse.computeIfAbsent(target, k -> new TreeSet<>()).add(entry.getKey());
            }
        }
        return reverse;
    }
}
