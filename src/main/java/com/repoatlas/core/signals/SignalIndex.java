package com.repoatlas.core.signals;

import com.repoatlas.core.model.Signal;
import com.repoatlas.core.model.SignalCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Run-level aggregation: category, then value, then the files reporting it.
 */
public class SignalIndex {

    private final Map<SignalCategory, SortedMap<String, SortedSet<String>>> index = new EnumMap<>(SignalCategory.class);

    public void add(FileSignals file) {
        for (Signal signal : file.signals()) {
            index.computeIfAbsent(signal.category(), c -> new TreeMap<>())
                    .computeIfAbsent(signal.value(), v -> new TreeSet<>())
                    .add(file.path());
        }
    }

    public SortedMap<String, SortedSet<String>> values(SignalCategory category) {
        return Collections.unmodifiableSortedMap(index.getOrDefault(category, new TreeMap<>()));
    }

    public SortedSet<String> files(SignalCategory category, String value) {
        return values(category).getOrDefault(value, new TreeSet<>());
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    public Map<SignalCategory, SortedMap<String, SortedSet<String>>> asMap() {
        return Collections.unmodifiableMap(index);
    }
}
