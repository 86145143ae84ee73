package com.repoatlas.core.profile;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits section drafts into a character budget in priority order. A section that does
 * not fit loses items from the end; a section that cannot fit even its heading is
 * omitted and named in the closing notes section.
 */
final class BudgetAllocator {

    private static final int NOTES_RESERVE = 160;

    private BudgetAllocator() {} // utility class

    static Profile allocate(String name, List<SectionDraft> drafts, List<String> notes, int budget) {
        int reserve = Math.min(NOTES_RESERVE, budget / 4);
        int remaining = budget - reserve;
        var sections = new ArrayList<ProfileSection>();
        var omitted = new ArrayList<String>();

        for (SectionDraft draft : drafts) {
            if (draft.isEmpty()) {
                continue;
            }
            ProfileSection section = fit(draft, remaining);
            if (section == null) {
                omitted.add(draft.title());
                continue;
            }
            sections.add(section);
            remaining -= section.chars();
        }

        remaining += reserve;
        var noteLines = new ArrayList<String>();
        if (!omitted.isEmpty()) {
            noteLines.add("- Omitted for budget: " + String.join(", ", omitted));
        }
        notes.forEach(note -> noteLines.add("- " + note));
        if (!noteLines.isEmpty()) {
            ProfileSection notesSection = fit(SectionDraft.items("Notes", noteLines, noteLines.size()), remaining);
            if (notesSection != null) {
                sections.add(notesSection);
            }
        }
        return new Profile(name, budget, sections, omitted);
    }

    /** Largest rendering of {@code draft} within {@code available} characters, or null. */
    static ProfileSection fit(SectionDraft draft, int available) {
        int shown = draft.maxShown();
        ProfileSection section = draft.render(shown);
        while (section.chars() > available && shown > 0) {
            shown--;
            section = draft.render(shown);
        }
        if (section.chars() > available) {
            return null;
        }
        if (shown == 0 && !draft.items().isEmpty() && draft.preamble().isEmpty()) {
            return null;
        }
        return section;
    }
}
