package com.repoatlas.core.analysis;

import com.repoatlas.core.graph.ModuleGraph;
import com.repoatlas.core.signals.FileSignals;
import com.repoatlas.core.signals.SignalIndex;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Everything one walk-extract-build pass produced.
 *
 * @param files         extraction results, sorted by path
 * @param newestChange  latest modification time among the scanned files
 * @param warnings      non-fatal problems: unreadable entries, truncated files
 */
public record AnalysisResult(
        Path root,
        List<FileSignals> files,
        SignalIndex signals,
        ModuleGraph graph,
        Instant newestChange,
        List<String> warnings
) {}
