package org.buildlens.compiler.api;

/**
 * The severity a compiler assigns to a {@link Problem}.
 */
public enum Severity {
    /** An informational note. */
    INFO,
    /** A warning that does not fail the compilation. */
    WARNING,
    /** An error that fails the compilation. */
    ERROR
}
