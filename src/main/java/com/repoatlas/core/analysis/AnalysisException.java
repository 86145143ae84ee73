package com.repoatlas.core.analysis;

/**
 * Raised when an analysis cannot start at all, e.g. the root is missing or
 * nothing in it matches the scan configuration. Partial failures are reported
 * as warnings instead.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
