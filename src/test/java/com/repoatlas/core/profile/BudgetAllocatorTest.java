package com.repoatlas.core.profile;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BudgetAllocatorTest {

    private static List<String> lines(String prefix, int count) {
        var lines = new ArrayList<String>();
        for (int i = 0; i < count; i++) {
            lines.add("- " + prefix + " item number " + i);
        }
        return lines;
    }

    @Test
    @DisplayName("everything fits under a generous budget")
    void generousBudget() {
        Profile profile = BudgetAllocator.allocate("demo", List.of(
                SectionDraft.fixed(1, "Title", List.of("intro")),
                SectionDraft.items("Things", lines("thing", 3), 10)), List.of(), 10_000);

        assertEquals(2, profile.sections().size());
        assertTrue(profile.render().contains("## Things (3)\n"));
        assertTrue(profile.omitted().isEmpty());
    }

    @Test
    @DisplayName("the slot cap shows how many items were left out")
    void capIsAnnounced() {
        Profile profile = BudgetAllocator.allocate("demo", List.of(
                SectionDraft.items("Things", lines("thing", 8), 5)), List.of(), 10_000);

        assertTrue(profile.render().contains("## Things (8 items, showing 5 of 8)"), profile.render());
        assertTrue(profile.sections().get(0).truncated());
    }

    @Test
    @DisplayName("a tight budget shrinks sections and never exceeds the limit")
    void tightBudget() {
        var drafts = List.of(
                SectionDraft.fixed(1, "Title", List.of("intro line")),
                SectionDraft.items("First", lines("first", 20), 20),
                SectionDraft.items("Second", lines("second", 20), 20),
                SectionDraft.items("Third", lines("third", 20), 20));

        for (int budget : new int[]{120, 300, 600, 1000}) {
            Profile profile = BudgetAllocator.allocate("demo", drafts, List.of("note"), budget);
            assertTrue(profile.chars() <= budget, "Budget " + budget + " exceeded: " + profile.chars());
            assertEquals(profile.render().length(), profile.chars());
        }
    }

    @Test
    @DisplayName("sections that cannot fit are omitted and named in the notes")
    void omittedSectionsAreNamed() {
        var drafts = List.of(
                SectionDraft.items("First", lines("first", 10), 10),
                SectionDraft.items("Second", lines("second", 10), 10));
        Profile profile = BudgetAllocator.allocate("demo", drafts, List.of(), 300);

        assertTrue(profile.omitted().contains("Second"), profile.render());
        assertTrue(profile.render().contains("Omitted for budget: Second"), profile.render());
        assertTrue(profile.chars() <= 300);
    }

    @Test
    @DisplayName("empty drafts are skipped silently")
    void emptyDrafts() {
        Profile profile = BudgetAllocator.allocate("demo", List.of(SectionDraft.items("Nothing", List.of(), 5)), List.of(), 500);
        assertTrue(profile.sections().isEmpty());
        assertTrue(profile.omitted().isEmpty());
    }
}
