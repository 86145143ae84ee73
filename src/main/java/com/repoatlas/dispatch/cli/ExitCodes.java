package com.repoatlas.dispatch.cli;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int GATE_FAILED = 1;
    public static final int GATE_HALTED = 2;
    public static final int INPUT_ERROR = 3;
    /** Output or state could not be written. */
    public static final int IO_ERROR = 4;

    private ExitCodes() {}
}
