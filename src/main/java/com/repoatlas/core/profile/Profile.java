package com.repoatlas.core.profile;

import java.util.List;

/**
 * A budgeted document: sections in priority order plus the titles of sections that
 * did not fit at all.
 */
public record Profile(String name, int budget, List<ProfileSection> sections, List<String> omitted) {

    public Profile {
        sections = List.copyOf(sections);
        omitted = List.copyOf(omitted);
    }

    public String render() {
        var text = new StringBuilder();
        sections.forEach(s -> text.append(s.text()));
        return text.toString();
    }

    public int chars() {
        return sections.stream().mapToInt(ProfileSection::chars).sum();
    }
}
