package com.repoatlas.core.model;

import java.util.List;

/**
 * Result of one gate evaluation.
 *
 * @param outcome             one of PASSED, FAILED, HALTED, BYPASSED
 * @param consecutiveFailures counter after this evaluation
 * @param threshold           failure threshold in effect
 * @param escalate            true when the change's blast radius exceeds the escalation threshold
 * @param reason              machine-readable reason code
 * @param summary             one-line human-readable summary
 * @param checks              per-check results; empty when no check ran
 */
public record GateDecision(
        GateState outcome,
        int consecutiveFailures,
        int threshold,
        boolean escalate,
        String reason,
        String summary,
        List<CheckResult> checks
) {
    public static final String REASON_CIRCUIT_OPEN = "circuit_open";
    public static final String REASON_CHECKS_PASSED = "checks_passed";
    public static final String REASON_CHECKS_FAILED = "checks_failed";
    public static final String REASON_BYPASS = "bypass_requested";

    public GateDecision {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    /** Copy with {@code note} appended to the summary in parentheses. */
    public GateDecision withNote(String note) {
        return new GateDecision(outcome, consecutiveFailures, threshold, escalate, reason,
                summary + " (" + note + ")", checks);
    }

    /** True when the caller may proceed: PASSED or an explicit bypass. */
    public boolean allowsProceed() {
        return outcome == GateState.PASSED || outcome == GateState.BYPASSED;
    }
}
