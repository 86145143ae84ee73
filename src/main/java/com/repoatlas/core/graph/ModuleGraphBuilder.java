package com.repoatlas.core.graph;

import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.model.Edge;
import com.repoatlas.core.model.Module;
import com.repoatlas.core.signals.FileCategorizer;
import com.repoatlas.core.signals.FileSignals;
import com.repoatlas.core.signals.RawReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns per-file extraction results into a {@link ModuleGraph}. Inputs are sorted by path
 * first, so the graph does not depend on the order files were scanned in.
 */
@Service
public class ModuleGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(ModuleGraphBuilder.class);

    private final AtlasProperties.Graph config;

    public ModuleGraphBuilder(AtlasProperties properties) {
        this.config = properties.getGraph();
    }

    public ModuleGraph build(List<FileSignals> files) {
        var sorted = files.stream()
                .filter(f -> f.category().isCode())
                .sorted(Comparator.comparing(FileSignals::path))
                .toList();

        var modules = new ArrayList<Module>(sorted.size());
        Set<String> paths = new TreeSet<>();
        for (FileSignals file : sorted) {
            modules.add(new Module(file.path(), ModuleNaming.logicalName(file.path()), file.category(),
                    FileCategorizer.language(file.extension()), file.lines(), file.barrel()));
            paths.add(file.path());
        }

        var resolver = new ReferenceResolver(paths, config.getAliases(), config.getSourceRoots());
        Map<String, Edge> edges = new LinkedHashMap<>();
        int unresolved = 0;
        var sample = new ArrayList<String>();

        for (FileSignals file : sorted) {
            for (RawReference reference : file.references()) {
                Optional<ReferenceResolver.Resolved> resolved = resolver.resolve(file.path(), reference, file.syntax());
                if (resolved.isEmpty()) {
                    unresolved++;
                    if (sample.size() < config.getUnresolvedSampleSize()) {
                        sample.add(file.path() + " -> " + reference.specifier());
                    }
                    continue;
                }
                String target = resolved.get().path();
                if (target.equals(file.path())) {
                    continue;
                }
                var edge = new Edge(file.path(), target, reference.kind(), resolved.get().resolution());
                edges.merge(file.path() + "\u0000" + target, edge, ModuleGraphBuilder::mergeDuplicate);
            }
        }

        log.info("Built module graph: {} modules, {} edges, {} unresolved references",
                modules.size(), edges.size(), unresolved);
        return new ModuleGraph(modules, edges.values(), unresolved, sample);
    }

    /** Keeps the first resolution seen; a re-export wins over a plain reference. */
    private static Edge mergeDuplicate(Edge first, Edge second) {
        if (first.kind() == Edge.Kind.REEXPORT || second.kind() == Edge.Kind.REFERENCE) {
            return first;
        }
        return new Edge(first.from(), first.to(), Edge.Kind.REEXPORT, first.resolution());
    }
}
