package com.repoatlas.core.signals;

/**
 * Reference syntax family of a file; decides which import patterns apply and how
 * specifiers are resolved.
 */
public enum Syntax {
    SCRIPT,
    PYTHON,
    JAVA,
    NONE
}
