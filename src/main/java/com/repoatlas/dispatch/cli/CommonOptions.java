package com.repoatlas.dispatch.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every analysis command.
 */
public class CommonOptions {

    @Option(names = {"-r", "--root"}, defaultValue = ".", description = "Project root (default: current directory)")
    Path root;

    @Option(names = "--json", description = "Print machine-readable JSON instead of console output")
    boolean json;

    @Option(names = "--include-tests", description = "Include test files in the scan")
    boolean includeTests;

    Path root() {
        return root.toAbsolutePath().normalize();
    }
}
