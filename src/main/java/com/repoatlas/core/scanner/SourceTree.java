package com.repoatlas.core.scanner;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Function;

/**
 * Cold, restartable sequence of the files under a root. Every call to
 * {@link #iterator()} starts a fresh walk with its own {@link WalkReport}.
 */
public class SourceTree implements Iterable<SourceFile> {

    private final Path root;
    private final Function<WalkReport, Iterator<SourceFile>> walkFactory;
    private WalkReport lastReport = new WalkReport();

    SourceTree(Path root, Function<WalkReport, Iterator<SourceFile>> walkFactory) {
        this.root = root;
        this.walkFactory = walkFactory;
    }

    public Path root() {
        return root;
    }

    @Override
    public Iterator<SourceFile> iterator() {
        lastReport = new WalkReport();
        return walkFactory.apply(lastReport);
    }

    /** Report for the most recently started pass. */
    public WalkReport lastReport() {
        return lastReport;
    }

    /** Drains one full pass into a list. */
    public List<SourceFile> toList() {
        var files = new ArrayList<SourceFile>();
        forEach(files::add);
        return files;
    }
}
