package com.repoatlas.core.vcs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GitChangeSetProviderTest {

    @TempDir
    Path tempDir;

    GitChangeSetProvider provider = new GitChangeSetProvider();

    @Test
    @DisplayName("parses name-only output, dropping blank lines")
    void parsesNameOnly() {
        assertEquals(List.of("src/a.ts", "src/b.ts"), GitChangeSetProvider.parseNameOnly("src/a.ts\n\n  src/b.ts  \n"));
        assertTrue(GitChangeSetProvider.parseNameOnly("").isEmpty());
    }

    @Test
    @DisplayName("a directory outside any work tree has no version control")
    void noVcs() {
        ChangeSet changeSet = provider.changedFiles(tempDir);
        assertEquals(ChangeSet.Source.NO_VCS, changeSet.source());
        assertTrue(changeSet.files().isEmpty());
    }

    @Test
    @DisplayName("explicit change sets keep the given files")
    void explicit() {
        ChangeSet changeSet = ChangeSet.explicit(List.of("a.js"));
        assertEquals(ChangeSet.Source.EXPLICIT, changeSet.source());
        assertEquals(List.of("a.js"), changeSet.files());
    }
}
