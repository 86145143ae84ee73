package com.repoatlas.core.scanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Diagnostics collected during a single pass of a {@link SourceTree}.
 */
public class WalkReport {

    private final List<String> warnings = new ArrayList<>();
    private int filesAccepted;
    private int skippedLarge;
    private int skippedTests;
    private int skippedLinks;

    void warn(String warning) {
        warnings.add(warning);
    }

    void accepted() { filesAccepted++; }
    void countLarge() { skippedLarge++; }
    void countTest() { skippedTests++; }
    void countLink() { skippedLinks++; }

    public List<String> warnings() { return Collections.unmodifiableList(warnings); }
    public int filesAccepted() { return filesAccepted; }
    public int skippedLarge() { return skippedLarge; }
    public int skippedTests() { return skippedTests; }
    public int skippedLinks() { return skippedLinks; }
}
