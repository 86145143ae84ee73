package com.repoatlas.core.profile;

import com.repoatlas.core.signals.FileSignals;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-directory file counts used to rank directories for the profile. Source-heavy
 * directories rank ahead of documentation and asset directories.
 */
record DirectoryStats(String path, int totalFiles, int sourceFiles) {

    double sourceRatio() {
        return totalFiles == 0 ? 0 : (double) sourceFiles / totalFiles;
    }

    /** Directories ordered by source ratio (descending), then path. */
    static List<DirectoryStats> rank(List<FileSignals> files) {
        Map<String, int[]> counts = new TreeMap<>();
        for (FileSignals file : files) {
            int[] count = counts.computeIfAbsent(directoryOf(file.path()), d -> new int[2]);
            count[0]++;
            if (file.category().isCode()) {
                count[1]++;
            }
        }
        var stats = new ArrayList<DirectoryStats>();
        counts.forEach((path, count) -> stats.add(new DirectoryStats(path, count[0], count[1])));
        stats.sort(Comparator.comparingDouble(DirectoryStats::sourceRatio).reversed()
                .thenComparing(DirectoryStats::path));
        return stats;
    }

    static String directoryOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }
}
