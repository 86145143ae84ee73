package com.repoatlas.core.analysis;

import com.repoatlas.core.graph.ModuleGraph;
import com.repoatlas.core.graph.ModuleGraphBuilder;
import com.repoatlas.core.metrics.AtlasMetrics;
import com.repoatlas.core.scanner.FileWalker;
import com.repoatlas.core.scanner.SourceFile;
import com.repoatlas.core.scanner.SourceTree;
import com.repoatlas.core.signals.FileSignals;
import com.repoatlas.core.signals.SignalExtractor;
import com.repoatlas.core.signals.SignalIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the walk, extract and graph-build stages in order for one root.
 */
@Service
public class ProjectAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private final FileWalker walker;
    private final SignalExtractor extractor;
    private final ModuleGraphBuilder graphBuilder;
    private final AtlasMetrics metrics;

    public ProjectAnalyzer(FileWalker walker, SignalExtractor extractor, ModuleGraphBuilder graphBuilder,
                           AtlasMetrics metrics) {
        this.walker = walker;
        this.extractor = extractor;
        this.graphBuilder = graphBuilder;
        this.metrics = metrics;
    }

    /**
     * @throws AnalysisException if the root is invalid or no file matches the scan configuration
     */
    public AnalysisResult analyze(Path root, boolean includeTests) {
        long start = System.currentTimeMillis();
        SourceTree tree = walker.walk(root, includeTests);

        var files = new ArrayList<FileSignals>();
        var warnings = new ArrayList<String>();
        Instant newest = Instant.EPOCH;
        for (SourceFile file : tree) {
            try {
                FileSignals signals = extractor.extract(file);
                files.add(signals);
                if (signals.truncated()) {
                    warnings.add("Truncated analysis of " + file.relativePath() + " (" + signals.lines() + " lines)");
                }
                Instant modified = Files.getLastModifiedTime(file.absolutePath()).toInstant();
                if (modified.isAfter(newest)) {
                    newest = modified;
                }
            } catch (IOException e) {
                String warning = "Unreadable file " + file.relativePath() + ": " + e.getMessage();
                log.warn(warning);
                warnings.add(warning);
            }
        }
        warnings.addAll(0, tree.lastReport().warnings());

        if (files.isEmpty()) {
            throw new AnalysisException("No source files matched under " + tree.root());
        }
        files.sort(Comparator.comparing(FileSignals::path));

        var index = new SignalIndex();
        files.forEach(index::add);
        ModuleGraph graph = graphBuilder.build(files);

        long elapsed = System.currentTimeMillis() - start;
        metrics.recordScan(files.size(), elapsed);
        metrics.recordUnresolved(graph.unresolvedCount());
        log.info("Analysed {} files under {} in {}ms ({} skipped as tests, {} too large)",
                files.size(), tree.root(), elapsed, tree.lastReport().skippedTests(), tree.lastReport().skippedLarge());
        return new AnalysisResult(tree.root(), List.copyOf(files), index, graph, newest, List.copyOf(warnings));
    }
}
