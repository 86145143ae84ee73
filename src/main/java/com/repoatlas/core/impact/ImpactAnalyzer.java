package com.repoatlas.core.impact;

import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.graph.ModuleGraph;
import com.repoatlas.core.model.Cycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes which modules a change can break (reverse reachability over the module graph)
 * and which modules participate in circular dependencies.
 */
@Service
public class ImpactAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ImpactAnalyzer.class);

    /** Application entry points; touching one is always critical. */
    private static final Set<String> ENTRYPOINT_HINTS = Set.of(
            "src/index.js", "src/index.ts", "src/main.js", "src/main.ts", "src/main.tsx", "src/App.tsx",
            "index.js", "index.ts", "main.py", "app.py", "server.js", "server.ts", "manage.py");

    /** Project configuration files, matched by file name anywhere in the tree. */
    private static final Set<String> CONFIG_FILE_NAMES = Set.of(
            "package.json", "tsconfig.json", "pyproject.toml", "requirements.txt", "pom.xml",
            "build.gradle", ".env", ".env.local", "vite.config.js", "vite.config.ts",
            "next.config.js", "next.config.mjs", "webpack.config.js", "settings.py");

    private final AtlasProperties.Impact config;

    public ImpactAnalyzer(AtlasProperties properties) {
        this.config = properties.getImpact();
    }

    /**
     * Multi-source breadth-first search along reverse edges.
     *
     * @param maxDepth maximum number of edges to follow; negative means unbounded
     */
    public BlastRadius blastRadius(ModuleGraph graph, Collection<String> seeds, int maxDepth) {
        var seedSet = new TreeSet<String>();
        for (String seed : seeds) {
            if (graph.contains(seed)) {
                seedSet.add(seed);
            }
        }

        Map<String, Integer> expanded = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String seed : seedSet) {
            expanded.put(seed, 0);
            queue.add(seed);
        }

        SortedMap<String, Integer> reached = new TreeMap<>();
        while (!queue.isEmpty()) {
            String node = queue.poll();
            int depth = expanded.get(node);
            if (maxDepth >= 0 && depth >= maxDepth) {
                continue;
            }
            for (String dependent : graph.dependentsOf(node)) {
                reached.putIfAbsent(dependent, depth + 1);
                if (!expanded.containsKey(dependent)) {
                    expanded.put(dependent, depth + 1);
                    queue.add(dependent);
                }
            }
        }

        var direct = new TreeSet<String>();
        reached.forEach((module, distance) -> {
            if (distance == 1 && !seedSet.contains(module)) {
                direct.add(module);
            }
        });
        return new BlastRadius(
                Collections.unmodifiableSortedSet(seedSet),
                Collections.unmodifiableSortedSet(new TreeSet<>(reached.keySet())),
                Collections.unmodifiableSortedMap(reached),
                Collections.unmodifiableSortedSet(direct));
    }

    public List<Cycle> detectCycles(ModuleGraph graph) {
        return CycleDetector.detect(graph.adjacency(), config.getDirectCycleMaxLength());
    }

    /**
     * Full report for a change set: blast radius, escalation, impact level and cycles.
     * Changed paths unknown to the graph are reported, not fatal.
     *
     * @param maxDepth overrides the configured depth when non-null
     */
    public ImpactReport analyze(ModuleGraph graph, Collection<String> changedFiles, Integer maxDepth) {
        var changed = new TreeSet<String>();
        for (String file : changedFiles) {
            changed.add(normalize(file));
        }
        var unknown = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        for (String file : changed) {
            if (!graph.contains(file)) {
                unknown.add(file);
            }
        }
        if (!unknown.isEmpty()) {
            warnings.add("Not in module graph: " + String.join(", ", unknown));
            log.warn("{} changed file(s) are not part of the module graph: {}", unknown.size(), unknown);
        }
        if (changed.isEmpty()) {
            warnings.add("No changed files");
        }

        int depth = maxDepth != null ? maxDepth : config.getMaxDepth();
        BlastRadius radius = blastRadius(graph, changed, depth);
        int size = radius.size();
        boolean escalate = size > config.getEscalationThreshold();
        ImpactLevel level = classify(changed, radius);
        List<Cycle> cycles = detectCycles(graph);

        log.info("Blast radius of {} seed(s): {} module(s), level {}{}",
                radius.seeds().size(), size, level, escalate ? ", escalation required" : "");
        return new ImpactReport(List.copyOf(changed), List.copyOf(unknown), radius, size, escalate, level, cycles, warnings);
    }

    ImpactLevel classify(SortedSet<String> changed, BlastRadius radius) {
        boolean criticalFile = changed.stream().anyMatch(ImpactAnalyzer::isCriticalFile);
        int direct = radius.direct().size();
        if (criticalFile || direct > config.getCriticalDirectDependents()) {
            return ImpactLevel.CRITICAL;
        }
        if (direct >= config.getHighDirectDependents()) {
            return ImpactLevel.HIGH;
        }
        if (direct >= config.getMediumDirectDependents()) {
            return ImpactLevel.MEDIUM;
        }
        return ImpactLevel.LOW;
    }

    static boolean isCriticalFile(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        return ENTRYPOINT_HINTS.contains(path) || CONFIG_FILE_NAMES.contains(name);
    }

    static String normalize(String path) {
        String normalized = path.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }
}
