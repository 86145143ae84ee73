package com.repoatlas.core.gate;

import com.repoatlas.core.model.CheckResult;
import com.repoatlas.core.model.GateDecision;
import com.repoatlas.core.model.GateRecord;
import com.repoatlas.core.model.GateState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Pure transition functions of the gate circuit breaker. Nothing here touches the
 * filesystem, the clock or any shared state, so equal inputs always give equal decisions.
 * <pre>
 *   idle/passed/failed --run--&gt; running --all ok--&gt; passed   (counter := 0)
 *                                running --any bad-&gt; failed   (counter += 1)
 *   counter &gt;= threshold --run--&gt; halted (checks are not run, counter unchanged)
 *   any --bypass--&gt; bypassed (checks are not run, counter unchanged)
 * </pre>
 */
public final class GateStateMachine {

    private GateStateMachine() {} // utility class

    /**
     * Decides whether checks may run at all. An empty result means "proceed to running".
     */
    public static Optional<GateDecision> preflight(GateRecord record, GateContext context) {
        int failures = record.consecutiveFailures();
        if (context.bypass()) {
            return Optional.of(new GateDecision(GateState.BYPASSED, failures, context.failureThreshold(),
                    context.escalate(), GateDecision.REASON_BYPASS,
                    "Gate BYPASSED on request; failure streak stays at " + failures, List.of()));
        }
        if (failures >= context.failureThreshold()) {
            return Optional.of(new GateDecision(GateState.HALTED, failures, context.failureThreshold(),
                    context.escalate(), GateDecision.REASON_CIRCUIT_OPEN,
                    "Gate HALTED: " + failures + " consecutive failures (threshold " + context.failureThreshold()
                            + "); reset required before checks run again", List.of()));
        }
        return Optional.empty();
    }

    /**
     * Folds check results into a decision. Timeouts and crashed checks count as failures;
     * skipped checks do not.
     */
    public static GateDecision conclude(GateRecord record, List<CheckResult> results, GateContext context) {
        List<CheckResult> blocking = results.stream().filter(CheckResult::blocking).toList();
        if (blocking.isEmpty()) {
            return new GateDecision(GateState.PASSED, 0, context.failureThreshold(), context.escalate(),
                    GateDecision.REASON_CHECKS_PASSED,
                    "Gate PASSED: " + describe(results) + escalationNote(context), results);
        }
        int failures = record.consecutiveFailures() + 1;
        String names = blocking.stream()
                .map(r -> r.name() + (r.status() == CheckResult.Status.TIMED_OUT ? " (timed out)" : ""))
                .collect(Collectors.joining(", "));
        return new GateDecision(GateState.FAILED, failures, context.failureThreshold(), context.escalate(),
                GateDecision.REASON_CHECKS_FAILED,
                "Gate FAILED (" + failures + "/" + context.failureThreshold() + "): " + names + escalationNote(context),
                results);
    }

    /** Preflight, then conclusion over the given results. */
    public static GateDecision decide(GateRecord record, List<CheckResult> results, GateContext context) {
        return preflight(record, context).orElseGet(() -> conclude(record, results, context));
    }

    /** The record to persist after {@code decision}. */
    public static GateRecord next(GateDecision decision, Instant at) {
        return new GateRecord(decision.consecutiveFailures(), decision.outcome(), at);
    }

    private static String describe(List<CheckResult> results) {
        if (results.isEmpty()) {
            return "no checks configured";
        }
        long passed = results.stream().filter(r -> r.status() == CheckResult.Status.PASSED).count();
        long skipped = results.stream().filter(r -> r.status() == CheckResult.Status.SKIPPED).count();
        return passed + " check(s) passed" + (skipped > 0 ? ", " + skipped + " skipped" : "");
    }

    private static String escalationNote(GateContext context) {
        return context.escalate()
                ? "; blast radius " + context.blastRadiusSize() + " exceeds " + context.escalationThreshold() + ", escalate"
                : "";
    }
}
