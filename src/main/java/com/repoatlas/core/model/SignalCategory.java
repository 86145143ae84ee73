package com.repoatlas.core.model;

public enum SignalCategory {
    STATE_MANAGEMENT("State"),
    DATA_FETCHING("Data Fetching"),
    ROUTING("Routing"),
    ORM("Database"),
    AUTH("Auth"),
    TESTING("Testing");

    private final String label;

    SignalCategory(String label) {
        this.label = label;
    }

    /** Short human label used in console output and the profile. */
    public String label() {
        return label;
    }
}
