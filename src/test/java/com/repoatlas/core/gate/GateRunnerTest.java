package com.repoatlas.core.gate;

import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.metrics.AtlasMetrics;
import com.repoatlas.core.model.CheckResult;
import com.repoatlas.core.model.GateDecision;
import com.repoatlas.core.model.GateState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link GateRunner} with mocked checks and a real record store under {@code @TempDir}.
 */
class GateRunnerTest {

    @TempDir
    Path root;

    SimpleMeterRegistry registry;
    GateRecordStore store;
    GateRunner runner;

    private static final GateContext CONTEXT = new GateContext(3, false, null, 20);

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new GateRecordStore(new AtlasProperties());
        runner = new GateRunner(store, new AtlasMetrics(registry),
                Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    private GateCheck check(String name, CheckResult result) throws Exception {
        GateCheck check = mock(GateCheck.class);
        when(check.name()).thenReturn(name);
        when(check.timeout()).thenReturn(Duration.ofSeconds(5));
        when(check.run(any())).thenReturn(result);
        return check;
    }

    // ── Circuit breaker ──────────────────────────────────────────────

    @Test
    @DisplayName("three failures open the circuit and the fourth run halts without running checks")
    void failuresOpenCircuit() throws Exception {
        GateCheck failing = check("test", CheckResult.failed("test", "1 failing", 5));

        assertEquals(1, runner.run(root, List.of(failing), CONTEXT).consecutiveFailures());
        assertEquals(2, runner.run(root, List.of(failing), CONTEXT).consecutiveFailures());
        GateDecision third = runner.run(root, List.of(failing), CONTEXT);
        assertEquals(GateState.FAILED, third.outcome());
        assertEquals(3, third.consecutiveFailures());

        GateCheck untouched = check("lint", CheckResult.passed("lint", "", 1));
        GateDecision fourth = runner.run(root, List.of(untouched), CONTEXT);
        assertEquals(GateState.HALTED, fourth.outcome());
        assertEquals(3, fourth.consecutiveFailures());
        verify(untouched, never()).run(any());

        assertEquals(GateState.HALTED, store.load(root).lastOutcome());
        assertEquals(3, store.load(root).consecutiveFailures());
    }

    @Test
    @DisplayName("one pass resets the streak")
    void passResets() throws Exception {
        GateCheck failing = check("test", CheckResult.failed("test", "", 5));
        runner.run(root, List.of(failing), CONTEXT);
        runner.run(root, List.of(failing), CONTEXT);

        GateDecision decision = runner.run(root, List.of(check("test", CheckResult.passed("test", "", 5))), CONTEXT);
        assertEquals(GateState.PASSED, decision.outcome());
        assertEquals(0, store.load(root).consecutiveFailures());
        assertEquals(Instant.parse("2026-03-01T12:00:00Z"), store.load(root).lastRunAt());
    }

    @Test
    @DisplayName("reset is the way out of halted")
    void resetAfterHalt() throws Exception {
        GateCheck failing = check("test", CheckResult.failed("test", "", 5));
        for (int i = 0; i < 3; i++) {
            runner.run(root, List.of(failing), CONTEXT);
        }
        store.reset(root, Instant.EPOCH);

        GateDecision decision = runner.run(root, List.of(failing), CONTEXT);
        assertEquals(GateState.FAILED, decision.outcome());
        assertEquals(1, decision.consecutiveFailures());
    }

    @Test
    @DisplayName("bypass records the outcome but runs nothing and keeps the counter")
    void bypass() throws Exception {
        GateCheck failing = check("test", CheckResult.failed("test", "", 5));
        runner.run(root, List.of(failing), CONTEXT);

        GateCheck untouched = check("lint", CheckResult.passed("lint", "", 1));
        GateDecision decision = runner.run(root, List.of(untouched), new GateContext(3, true, null, 20));
        assertEquals(GateState.BYPASSED, decision.outcome());
        assertEquals(1, store.load(root).consecutiveFailures());
        verify(untouched, never()).run(any());
    }

    // ── Per-check containment ────────────────────────────────────────

    @Test
    @DisplayName("a check that outlives its timeout is reported as timed out")
    void timeout() throws Exception {
        GateCheck slow = mock(GateCheck.class);
        when(slow.name()).thenReturn("test");
        when(slow.timeout()).thenReturn(Duration.ofMillis(100));
        when(slow.run(any())).thenAnswer(invocation -> {
            Thread.sleep(10_000);
            return CheckResult.passed("test", "", 10_000);
        });

        GateDecision decision = runner.run(root, List.of(slow), CONTEXT);
        assertEquals(GateState.FAILED, decision.outcome());
        assertEquals(CheckResult.Status.TIMED_OUT, decision.checks().get(0).status());
    }

    @Test
    @DisplayName("an exception from a check becomes an error result and later checks still run")
    void crashingCheck() throws Exception {
        GateCheck crashing = mock(GateCheck.class);
        when(crashing.name()).thenReturn("lint");
        when(crashing.timeout()).thenReturn(Duration.ofSeconds(5));
        when(crashing.run(any())).thenThrow(new IllegalStateException("config missing"));
        GateCheck passing = check("test", CheckResult.passed("test", "", 1));

        GateDecision decision = runner.run(root, List.of(crashing, passing), CONTEXT);
        assertEquals(CheckResult.Status.ERROR, decision.checks().get(0).status());
        assertTrue(decision.checks().get(0).detail().contains("config missing"));
        verify(passing).run(root);
        assertEquals(GateState.FAILED, decision.outcome());
    }

    @Test
    @DisplayName("no checks at all is a pass")
    void noChecks() {
        assertEquals(GateState.PASSED, runner.run(root, List.of(), CONTEXT).outcome());
    }

    @Test
    @DisplayName("outcomes are counted in the meter registry")
    void recordsMetrics() throws Exception {
        runner.run(root, List.of(check("test", CheckResult.failed("test", "", 1))), CONTEXT);
        assertEquals(1.0, registry.get("atlas.gate.runs").tag("outcome", "failed").counter().count());
    }

    // ── Persistence failures ─────────────────────────────────────────

    @Test
    @DisplayName("a record that cannot be written still yields the decision, with a caveat")
    void unwritableState() throws Exception {
        Files.createDirectories(root.resolve(".atlas"));
        Files.writeString(root.resolve(".atlas/state"), "not a directory");
        GateCheck passing = check("lint", CheckResult.passed("lint", "clean", 1));

        GateDecision decision = runner.run(root, List.of(passing), CONTEXT);

        assertEquals(GateState.PASSED, decision.outcome());
        assertTrue(decision.summary().contains("state not persisted"), decision.summary());
        assertEquals(1.0, registry.get("atlas.gate.runs").tag("outcome", "passed").counter().count());
    }
}
