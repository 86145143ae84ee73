package com.repoatlas.core.impact;

import java.util.SortedMap;
import java.util.SortedSet;

/**
 * Reverse-reachability result for a set of seed modules.
 *
 * @param seeds    the changed modules the search started from
 * @param affected modules reached through at least one edge; a seed appears only when reached via a cycle
 * @param distance shortest distance from any seed, per affected module
 * @param direct   non-seed modules at distance 1
 */
public record BlastRadius(
        SortedSet<String> seeds,
        SortedSet<String> affected,
        SortedMap<String, Integer> distance,
        SortedSet<String> direct
) {
    /** Number of affected modules that are not themselves seeds. */
    public int size() {
        return (int) affected.stream().filter(m -> !seeds.contains(m)).count();
    }
}
