package com.repoatlas.core.gate;

import com.repoatlas.core.model.CheckResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs an external lint or test command and maps its exit code to a {@link CheckResult}.
 * <p>
 * Output goes to a temp file so a chatty tool cannot block on a full pipe. A missing
 * executable is reported as {@link CheckResult.Status#SKIPPED}, not as a failure.
 */
public class CommandCheck implements GateCheck {

    private static final Logger log = LoggerFactory.getLogger(CommandCheck.class);

    private final String name;
    private final String tool;
    private final List<String> command;
    private final Duration timeout;
    private final int summaryChars;

    public CommandCheck(String name, String tool, List<String> command, Duration timeout, int summaryChars) {
        this.name = name;
        this.tool = tool;
        this.command = List.copyOf(command);
        this.timeout = timeout;
        this.summaryChars = summaryChars;
    }

    @Override
    public String name() {
        return name;
    }

    public String tool() {
        return tool;
    }

    public List<String> command() {
        return command;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public CheckResult run(Path root) throws IOException {
        String display = String.join(" ", command);
        log.debug("Running: {}", display);
        Path output = Files.createTempFile("atlas-" + name, ".log");
        long start = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(root.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
        } catch (IOException e) {
            Files.deleteIfExists(output);
            log.warn("{}: '{}' could not be started ({}); skipping", name, tool, e.getMessage());
            return CheckResult.skipped(name, tool + " not available: " + e.getMessage());
        }

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (!finished) {
                destroyTree(process);
                return new CheckResult(name, CheckResult.Status.TIMED_OUT,
                        display + " timed out after " + timeout.toSeconds() + "s", elapsed);
            }
            // Tool output is not always UTF-8; malformed bytes become U+FFFD
            String summary = summarize(new String(Files.readAllBytes(output), StandardCharsets.UTF_8));
            int exitCode = process.exitValue();
            if (exitCode == 0) {
                return CheckResult.passed(name, display + (summary.isEmpty() ? "" : ": " + summary), elapsed);
            }
            return CheckResult.failed(name, display + " exited " + exitCode + (summary.isEmpty() ? "" : ": " + summary), elapsed);
        } catch (InterruptedException e) {
            // The runner cancels the check on timeout
            destroyTree(process);
            Thread.currentThread().interrupt();
            return new CheckResult(name, CheckResult.Status.TIMED_OUT, display + " was interrupted",
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        } finally {
            Files.deleteIfExists(output);
        }
    }

    /** First three non-blank lines joined with " | ", capped. */
    String summarize(String output) {
        String summary = output.lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .limit(3)
                .collect(Collectors.joining(" | "));
        return summary.length() > summaryChars ? summary.substring(0, summaryChars) : summary;
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    @Override
    public String toString() {
        return name + " (" + String.join(" ", command) + ")";
    }
}
