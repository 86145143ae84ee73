package com.repoatlas.core.scanner;

import java.nio.file.Path;

/**
 * A file accepted by the {@link FileWalker}.
 *
 * @param absolutePath location on disk
 * @param relativePath root-relative path, {@code /}-separated
 * @param extension    lower-case extension including the dot, or empty
 * @param sizeBytes    size at walk time
 */
public record SourceFile(Path absolutePath, String relativePath, String extension, long sizeBytes) {}
