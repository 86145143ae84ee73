package com.repoatlas.dispatch.cli;

import com.repoatlas.core.analysis.ProjectAnalyzer;
import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.gate.CheckDetector;
import com.repoatlas.core.gate.GateCheck;
import com.repoatlas.core.gate.GateRecordStore;
import com.repoatlas.core.gate.GateRunner;
import com.repoatlas.core.graph.ModuleGraphBuilder;
import com.repoatlas.core.impact.ImpactAnalyzer;
import com.repoatlas.core.metrics.AtlasMetrics;
import com.repoatlas.core.model.CheckResult;
import com.repoatlas.core.model.GateState;
import com.repoatlas.core.profile.ProfileSummarizer;
import com.repoatlas.core.profile.ProfileWriter;
import com.repoatlas.core.scanner.FileWalker;
import com.repoatlas.core.signals.SignalExtractor;
import com.repoatlas.core.vcs.ChangeSet;
import com.repoatlas.core.vcs.ChangeSetProvider;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Exercises the CLI through picocli without a Spring context. Analysis components are
 * real; version control and check detection are mocked.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path root;

    AtlasProperties properties = new AtlasProperties();
    AtlasMetrics metrics = new AtlasMetrics(new SimpleMeterRegistry());
    Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
    ChangeSetProvider changeSets = mock(ChangeSetProvider.class);
    CheckDetector detector = mock(CheckDetector.class);
    GateRecordStore store = new GateRecordStore(properties);

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("a.js"), "import b from './b';\n");
        Files.writeString(root.resolve("b.js"), "import c from './c';\n");
        Files.writeString(root.resolve("c.js"), "export const c = 1;\n");
        when(changeSets.changedFiles(any())).thenReturn(new ChangeSet(ChangeSet.Source.NO_VCS, List.of()));
        when(detector.detect(any())).thenReturn(new CheckDetector.DetectedChecks(List.of(), List.of()));
    }

    private CommandLine.IFactory createFactory() {
        ProjectAnalyzer analyzer = new ProjectAnalyzer(new FileWalker(properties), new SignalExtractor(properties),
                new ModuleGraphBuilder(properties), metrics);
        ImpactAnalyzer impact = new ImpactAnalyzer(properties);
        GateRunner runner = new GateRunner(store, metrics, clock);
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == GraphCommand.class) {
                    return (K) new GraphCommand(analyzer);
                }
                if (cls == SignalsCommand.class) {
                    return (K) new SignalsCommand(analyzer);
                }
                if (cls == ImpactCommand.class) {
                    return (K) new ImpactCommand(analyzer, impact, changeSets, metrics);
                }
                if (cls == GateRunCommand.class) {
                    return (K) new GateRunCommand(runner, detector, properties, analyzer, impact, changeSets);
                }
                if (cls == GateStatusCommand.class) {
                    return (K) new GateStatusCommand(store, properties);
                }
                if (cls == GateResetCommand.class) {
                    return (K) new GateResetCommand(store, clock);
                }
                if (cls == ProfileCommand.class) {
                    return (K) new ProfileCommand(analyzer, new ProfileSummarizer(properties, impact),
                            new ProfileWriter(properties));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = CliRunner.commandLine(new AtlasCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static GateCheck check(CheckResult result) throws Exception {
        GateCheck check = mock(GateCheck.class);
        when(check.name()).thenReturn(result.name());
        when(check.timeout()).thenReturn(Duration.ofSeconds(5));
        when(check.run(any())).thenReturn(result);
        return check;
    }

    // ── Help output ──────────────────────────────────────────────────

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("top-level help lists every subcommand")
        void topLevelHelp() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : List.of("graph", "signals", "impact", "gate", "profile")) {
                assertTrue(result.output().contains(sub), "Missing " + sub + " in help");
            }
        }

        @Test
        @DisplayName("gate help lists run, status and reset")
        void gateHelp() {
            CliResult result = execute("gate", "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("run"));
            assertTrue(result.output().contains("status"));
            assertTrue(result.output().contains("reset"));
        }

        @Test
        @DisplayName("an unknown option is an input error")
        void unknownOption() {
            CliResult result = execute("graph", "--no-such-option");
            assertEquals(ExitCodes.INPUT_ERROR, result.exitCode());
        }
    }

    // ── Analysis commands ────────────────────────────────────────────

    @Nested
    @DisplayName("Analysis commands")
    class AnalysisTests {

        @Test
        @DisplayName("graph emits modules and edges as JSON")
        void graphJson() {
            CliResult result = execute("graph", "--root", root.toString(), "--json");
            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("a.js"));
            assertTrue(result.output().contains("b.js"));
        }

        @Test
        @DisplayName("impact of a leaf reaches every importer")
        void impactOfLeaf() {
            CliResult result = execute("impact", "-r", root.toString(), "-c", "c.js", "--json");
            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("\"size\" : 2"), result.output());
            assertTrue(result.output().contains("\"source\" : \"explicit\""), result.output());
        }

        @Test
        @DisplayName("a missing root yields a structured error and exit code 3")
        void missingRoot() {
            CliResult result = execute("impact", "-r", root.resolve("missing").toString(), "--json");
            assertEquals(ExitCodes.INPUT_ERROR, result.exitCode());
            assertTrue(result.output().contains("\"status\" : \"error\""), result.output());
        }

        @Test
        @DisplayName("profile --dry-run prints without writing")
        void profileDryRun() {
            CliResult result = execute("profile", "-r", root.toString(), "--dry-run");
            assertEquals(0, result.exitCode(), result.output());
            assertTrue(result.output().contains("Project Profile"), result.output());
            assertFalse(Files.exists(root.resolve(".atlas/context/profile.md")));
        }

        @Test
        @DisplayName("a profile that cannot be written yields a structured error")
        void profileWriteFailure() throws IOException {
            Files.createDirectories(root.resolve(".atlas"));
            Files.writeString(root.resolve(".atlas/context"), "not a directory");

            CliResult result = execute("profile", "-r", root.toString(), "--json");
            assertEquals(ExitCodes.IO_ERROR, result.exitCode(), result.output());
            assertTrue(result.output().contains("\"status\" : \"error\""), result.output());
            assertFalse(result.output().contains("\tat "), result.output());
        }

        @Test
        @DisplayName("a non-positive profile budget is rejected")
        void badBudget() {
            CliResult result = execute("profile", "-r", root.toString(), "--budget", "0");
            assertEquals(ExitCodes.INPUT_ERROR, result.exitCode());
        }
    }

    // ── Gate ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Gate")
    class GateTests {

        @Test
        @DisplayName("passing checks exit 0")
        void passes() throws Exception {
            GateCheck lint = check(CheckResult.passed("lint", "clean", 5));
            when(detector.detect(any())).thenReturn(new CheckDetector.DetectedChecks(List.of(lint), List.of()));

            CliResult result = execute("gate", "run", "-r", root.toString());
            assertEquals(ExitCodes.OK, result.exitCode(), result.output());
        }

        @Test
        @DisplayName("a failing check exits 1, then the open circuit exits 2")
        void failsThenHalts() throws Exception {
            GateCheck tests = check(CheckResult.failed("test", "2 failures", 5));
            when(detector.detect(any())).thenReturn(new CheckDetector.DetectedChecks(List.of(tests), List.of()));

            assertEquals(ExitCodes.GATE_FAILED, execute("gate", "run", "-r", root.toString(), "--threshold", "1").exitCode());
            assertEquals(ExitCodes.GATE_HALTED, execute("gate", "run", "-r", root.toString(), "--threshold", "1").exitCode());
            assertEquals(1, store.load(root).consecutiveFailures());
        }

        @Test
        @DisplayName("bypass proceeds without running checks")
        void bypass() {
            CliResult result = execute("gate", "run", "-r", root.toString(), "--bypass");
            assertEquals(ExitCodes.OK, result.exitCode(), result.output());
            assertEquals(GateState.BYPASSED, store.load(root).lastOutcome());
        }

        @Test
        @DisplayName("reset clears the failure streak")
        void reset() throws Exception {
            GateCheck lint = check(CheckResult.failed("lint", "bad", 5));
            when(detector.detect(any())).thenReturn(new CheckDetector.DetectedChecks(List.of(lint), List.of()));
            execute("gate", "run", "-r", root.toString());

            assertEquals(ExitCodes.OK, execute("gate", "reset", "-r", root.toString()).exitCode());
            assertEquals(0, store.load(root).consecutiveFailures());
            assertEquals(GateState.IDLE, store.load(root).lastOutcome());
        }

        @Test
        @DisplayName("an unwritable state directory still prints the decision")
        void unwritableState() throws Exception {
            Files.createDirectories(root.resolve(".atlas"));
            Files.writeString(root.resolve(".atlas/state"), "not a directory");
            GateCheck lint = check(CheckResult.passed("lint", "clean", 5));
            when(detector.detect(any())).thenReturn(new CheckDetector.DetectedChecks(List.of(lint), List.of()));

            CliResult result = execute("gate", "run", "-r", root.toString());
            assertEquals(ExitCodes.OK, result.exitCode(), result.output());
            assertTrue(result.output().contains("state not persisted"), result.output());
        }

        @Test
        @DisplayName("a reset that cannot be written is a structured error")
        void unwritableReset() throws IOException {
            Files.createDirectories(root.resolve(".atlas"));
            Files.writeString(root.resolve(".atlas/state"), "not a directory");

            CliResult result = execute("gate", "reset", "-r", root.toString(), "--json");
            assertEquals(ExitCodes.IO_ERROR, result.exitCode(), result.output());
            assertTrue(result.output().contains("\"status\" : \"error\""), result.output());
        }

        @Test
        @DisplayName("a threshold below one is rejected")
        void badThreshold() {
            assertEquals(ExitCodes.INPUT_ERROR, execute("gate", "run", "-r", root.toString(), "--threshold", "0").exitCode());
        }
    }
}
