package com.repoatlas.core.model;

import java.util.List;

/**
 * A closed dependency path. {@code modules} lists each member once, in path order;
 * the last element depends on the first.
 *
 * @param modules       ordered members of the cycle
 * @param kind          {@link Kind#DIRECT} for short cycles, {@link Kind#INDIRECT} otherwise
 * @param componentSize size of the strongly connected component the cycle was drawn from
 */
public record Cycle(List<String> modules, Kind kind, int componentSize) {

    public enum Kind { DIRECT, INDIRECT }

    public int length() {
        return modules.size();
    }
}
