package com.repoatlas.core.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Reads the change set from git: staged changes first, then unstaged, then the last
 * commit. Shells out to the {@code git} CLI via {@link ProcessBuilder}.
 */
@Component
public class GitChangeSetProvider implements ChangeSetProvider {

    private static final Logger log = LoggerFactory.getLogger(GitChangeSetProvider.class);

    private static final long GIT_TIMEOUT_SECONDS = 60;

    @Override
    public ChangeSet changedFiles(Path root) {
        Optional<String> inside = runGitOutput(root, "rev-parse", "--is-inside-work-tree");
        if (inside.isEmpty() || !"true".equals(inside.get().strip())) {
            log.info("{} is not inside a git work tree", root);
            return new ChangeSet(ChangeSet.Source.NO_VCS, List.of());
        }

        List<String> staged = parseNameOnly(runGitOutput(root, "diff", "--cached", "--name-only").orElse(""));
        if (!staged.isEmpty()) {
            return new ChangeSet(ChangeSet.Source.STAGED, staged);
        }
        List<String> unstaged = parseNameOnly(runGitOutput(root, "diff", "--name-only").orElse(""));
        if (!unstaged.isEmpty()) {
            return new ChangeSet(ChangeSet.Source.UNSTAGED, unstaged);
        }
        List<String> lastCommit = parseNameOnly(runGitOutput(root, "diff", "--name-only", "HEAD~1", "HEAD").orElse(""));
        if (!lastCommit.isEmpty()) {
            return new ChangeSet(ChangeSet.Source.LAST_COMMIT, lastCommit);
        }
        return new ChangeSet(ChangeSet.Source.NONE, List.of());
    }

    /**
     * Parses {@code git diff --name-only} output: one path per line, blanks dropped.
     */
    static List<String> parseNameOnly(String output) {
        var files = new ArrayList<String>();
        for (String line : output.split("\n")) {
            String path = line.strip();
            if (!path.isEmpty()) {
                files.add(path);
            }
        }
        return files;
    }

    /**
     * Runs a git command and captures stdout; empty when git is missing, fails or times out.
     */
    Optional<String> runGitOutput(Path workDir, String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running (capture): {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            log.warn("git is not available: {}", e.getMessage());
            return Optional.empty();
        }

        try {
            String output;
            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }
            if (!process.waitFor(GIT_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.warn("git {} timed out", String.join(" ", args));
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                log.debug("git command exited with code {}: {}", process.exitValue(), String.join(" ", command));
                return Optional.empty();
            }
            return Optional.of(output);
        } catch (IOException e) {
            log.warn("Reading git output failed: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return Optional.empty();
        }
    }
}
