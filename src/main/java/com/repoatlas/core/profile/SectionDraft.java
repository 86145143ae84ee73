package com.repoatlas.core.profile;

import java.util.List;

/**
 * Unrendered section: a fixed preamble followed by items that can be cut from the end.
 *
 * @param level     heading level, 1 for the document title
 * @param preamble  lines always shown when the section is shown
 * @param items     candidate lines, most important first
 * @param cap       slot limit; at most this many items are ever shown
 * @param countable whether the heading carries item counts
 */
record SectionDraft(int level, String title, List<String> preamble, List<String> items, int cap, boolean countable) {

    static SectionDraft items(String title, List<String> items, int cap) {
        return new SectionDraft(2, title, List.of(), items, cap, true);
    }

    static SectionDraft fixed(int level, String title, List<String> lines) {
        return new SectionDraft(level, title, lines, List.of(), 0, false);
    }

    boolean isEmpty() {
        return preamble.isEmpty() && items.isEmpty();
    }

    int maxShown() {
        return Math.min(cap, items.size());
    }

    ProfileSection render(int shown) {
        var text = new StringBuilder();
        text.append("#".repeat(level)).append(' ').append(title);
        if (countable) {
            int total = items.size();
            text.append(shown < total
                    ? " (" + total + " items, showing " + shown + " of " + total + ")"
                    : " (" + total + ")");
        }
        text.append('\n');
        preamble.forEach(line -> text.append(line).append('\n'));
        items.subList(0, shown).forEach(line -> text.append(line).append('\n'));
        text.append('\n');
        return new ProfileSection(title, text.toString(), shown, countable ? items.size() : shown);
    }
}
