package com.repoatlas.core.signals;

import com.repoatlas.core.model.FileCategory;
import com.repoatlas.core.model.SignalCategory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One row of the signal table: a value reported for a category when any of its
 * patterns matches a file whose category is in {@code scope}.
 */
public record PatternGroup(
        SignalCategory category,
        String value,
        Set<FileCategory> scope,
        List<Pattern> patterns
) {
    public static PatternGroup of(SignalCategory category, String value, Set<FileCategory> scope, String... regexes) {
        return new PatternGroup(category, value, EnumSet.copyOf(scope),
                List.of(regexes).stream().map(Pattern::compile).toList());
    }

    public boolean appliesTo(FileCategory fileCategory) {
        return scope.contains(fileCategory);
    }

    public boolean matches(String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
