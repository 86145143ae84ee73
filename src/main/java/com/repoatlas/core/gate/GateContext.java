package com.repoatlas.core.gate;

/**
 * Inputs to a gate evaluation besides the persisted record and the check results.
 *
 * @param failureThreshold    consecutive failures that open the circuit
 * @param bypass              caller explicitly skips the gate
 * @param blastRadiusSize     size of the change's blast radius, or null when unknown
 * @param escalationThreshold blast radius size above which a decision is escalated
 */
public record GateContext(int failureThreshold, boolean bypass, Integer blastRadiusSize, int escalationThreshold) {

    public GateContext {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
    }

    public boolean escalate() {
        return blastRadiusSize != null && blastRadiusSize > escalationThreshold;
    }
}
