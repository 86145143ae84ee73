package com.repoatlas.core.model;

/**
 * Outcome of a single gate check.
 */
public record CheckResult(
        String name,
        Status status,
        String detail,
        long durationMs
) {
    public enum Status { PASSED, FAILED, TIMED_OUT, SKIPPED, ERROR }

    /** A check blocks the gate when it failed, crashed or ran out of time. */
    public boolean blocking() {
        return status == Status.FAILED || status == Status.TIMED_OUT || status == Status.ERROR;
    }

    public static CheckResult passed(String name, String detail, long durationMs) {
        return new CheckResult(name, Status.PASSED, detail, durationMs);
    }

    public static CheckResult failed(String name, String detail, long durationMs) {
        return new CheckResult(name, Status.FAILED, detail, durationMs);
    }

    public static CheckResult skipped(String name, String detail) {
        return new CheckResult(name, Status.SKIPPED, detail, 0L);
    }
}
