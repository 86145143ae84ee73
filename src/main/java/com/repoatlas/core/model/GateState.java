package com.repoatlas.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of the change gate. {@link #RUNNING} is transient and never persisted.
 */
public enum GateState {
    IDLE,
    RUNNING,
    PASSED,
    FAILED,
    HALTED,
    BYPASSED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GateState fromWire(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
