package com.repoatlas.core.vcs;

import java.nio.file.Path;

/**
 * Source of the current change set when the caller does not name files explicitly.
 */
public interface ChangeSetProvider {

    ChangeSet changedFiles(Path root);
}
