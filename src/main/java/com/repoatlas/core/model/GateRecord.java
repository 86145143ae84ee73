package com.repoatlas.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Persisted gate state for one project root.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GateRecord(
        @JsonProperty("consecutive_failures") int consecutiveFailures,
        @JsonProperty("last_outcome") GateState lastOutcome,
        @JsonProperty("last_run_at") Instant lastRunAt
) {
    public GateRecord {
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutive_failures must be >= 0, got " + consecutiveFailures);
        }
        if (lastOutcome == null) {
            lastOutcome = GateState.IDLE;
        }
    }

    public static GateRecord fresh() {
        return new GateRecord(0, GateState.IDLE, null);
    }

    public GateRecord withOutcome(GateState outcome, int failures, Instant at) {
        return new GateRecord(failures, outcome, at);
    }
}
