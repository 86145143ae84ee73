package com.repoatlas.core.scanner;

import com.repoatlas.core.analysis.AnalysisException;
import com.repoatlas.core.config.AtlasProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Walks a project directory and yields the source files worth analysing.
 * <p>
 * Denylisted directories (e.g. {@code .git}, {@code node_modules}, {@code target}) are pruned
 * before they are listed. Symbolic links are followed only while their target stays inside the
 * root, and every real directory is visited once. Unreadable entries become warnings on the
 * pass's {@link WalkReport}; they never abort the walk.
 */
@Service
public class FileWalker {

    private static final Logger log = LoggerFactory.getLogger(FileWalker.class);

    /** Individual files to skip during the walk. */
    private static final Set<String> IGNORE_FILES = Set.of(".DS_Store", "Thumbs.db");

    /** Test naming conventions across the supported languages. */
    private static final Pattern TEST_FILE = Pattern.compile(
            "(^|/)(tests?|__tests__|spec)/|(^|/)src/test/|\\.(test|spec)\\.[^/]+$|(^|/)test_[^/]+\\.py$|_test\\.(py|go)$|Tests?\\.(java|kt)$");

    private final AtlasProperties.Scan config;

    public FileWalker(AtlasProperties properties) {
        this.config = properties.getScan();
    }

    /**
     * Returns a lazy view over the accepted files under {@code root}.
     *
     * @param root         the project root; must be an existing directory
     * @param includeTests whether test files are yielded
     * @throws AnalysisException if the root is missing or not a directory
     */
    public SourceTree walk(Path root, boolean includeTests) {
        if (!Files.isDirectory(root)) {
            throw new AnalysisException("Root is not a directory: " + root);
        }
        Path absoluteRoot = root.toAbsolutePath().normalize();
        Path realRoot;
        try {
            realRoot = absoluteRoot.toRealPath();
        } catch (IOException e) {
            throw new AnalysisException("Cannot resolve root " + root + ": " + e.getMessage(), e);
        }
        return new SourceTree(absoluteRoot, report -> new WalkIterator(absoluteRoot, realRoot, includeTests, report));
    }

    public SourceTree walk(Path root) {
        return walk(root, config.isIncludeTests());
    }

    /** Returns {@code true} if the root-relative path follows a test naming convention. */
    public static boolean isTestFile(String relativePath) {
        return TEST_FILE.matcher(relativePath).find();
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    static String toRelative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private final class WalkIterator implements Iterator<SourceFile> {

        private final Path root;
        private final Path realRoot;
        private final boolean includeTests;
        private final WalkReport report;
        private final Deque<Path> pendingDirs = new ArrayDeque<>();
        private final Deque<SourceFile> pendingFiles = new ArrayDeque<>();
        private final Set<Path> visitedDirs = new HashSet<>();

        WalkIterator(Path root, Path realRoot, boolean includeTests, WalkReport report) {
            this.root = root;
            this.realRoot = realRoot;
            this.includeTests = includeTests;
            this.report = report;
            visitedDirs.add(realRoot);
            pendingDirs.push(root);
        }

        @Override
        public boolean hasNext() {
            while (pendingFiles.isEmpty() && !pendingDirs.isEmpty()) {
                expand(pendingDirs.pop());
            }
            return !pendingFiles.isEmpty();
        }

        @Override
        public SourceFile next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return pendingFiles.poll();
        }

        private void expand(Path dir) {
            var entries = new ArrayList<Path>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                stream.forEach(entries::add);
            } catch (IOException | SecurityException e) {
                warn("Unreadable directory " + relative(dir) + ": " + e.getMessage());
                return;
            }
            entries.sort(Comparator.comparing(p -> p.getFileName().toString()));

            List<Path> subdirs = new ArrayList<>();
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                Path target = entry;
                if (Files.isSymbolicLink(entry)) {
                    try {
                        target = entry.toRealPath();
                    } catch (IOException e) {
                        warn("Broken symbolic link " + relative(entry));
                        continue;
                    }
                    if (!target.startsWith(realRoot)) {
                        log.debug("Skipping link escaping the root: {} -> {}", relative(entry), target);
                        report.countLink();
                        continue;
                    }
                }

                if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
                    if (config.getExcludeDirs().contains(name)
                            || (config.isExcludeHiddenDirs() && name.startsWith("."))) {
                        continue;
                    }
                    if (markVisited(entry, target)) {
                        subdirs.add(entry);
                    } else {
                        report.countLink();
                    }
                } else if (Files.isRegularFile(target, LinkOption.NOFOLLOW_LINKS)) {
                    accept(entry, name);
                }
            }
            // Push in reverse so the stack pops subdirectories in sorted order
            for (int i = subdirs.size() - 1; i >= 0; i--) {
                pendingDirs.push(subdirs.get(i));
            }
        }

        private boolean markVisited(Path entry, Path target) {
            try {
                return visitedDirs.add(target == entry ? entry.toRealPath() : target);
            } catch (IOException e) {
                warn("Unreadable directory " + relative(entry) + ": " + e.getMessage());
                return false;
            }
        }

        private void accept(Path file, String name) {
            if (IGNORE_FILES.contains(name)) {
                return;
            }
            String extension = extensionOf(name);
            if (!config.getIncludeExtensions().contains(extension)) {
                return;
            }
            String relativePath = relative(file);
            if (!includeTests && isTestFile(relativePath)) {
                report.countTest();
                return;
            }
            if (!Files.isReadable(file)) {
                warn("Unreadable file " + relativePath);
                return;
            }
            long size;
            try {
                size = Files.size(file);
            } catch (IOException e) {
                warn("Cannot stat " + relativePath + ": " + e.getMessage());
                return;
            }
            if (size > config.getMaxFileSizeBytes()) {
                log.debug("Skipping {} ({} bytes exceeds limit)", relativePath, size);
                report.countLarge();
                return;
            }
            report.accepted();
            pendingFiles.add(new SourceFile(file, relativePath, extension, size));
        }

        private void warn(String warning) {
            log.warn(warning);
            report.warn(warning);
        }

        private String relative(Path path) {
            String relativePath = toRelative(root, path);
            return relativePath.isEmpty() ? "." : relativePath;
        }
    }
}
