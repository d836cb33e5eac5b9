package org.buildlens.compiler.api;

import java.util.Objects;

/**
 * A single issue found by the compiler.
 *
 * @param severity       The severity of the issue.
 * @param message        The human-readable message, passed on verbatim.
 * @param position       Where the issue occurred.
 * @param diagnosticCode An optional compiler-specific code (e.g. {@code "E0308"}), or {@code null}.
 */
public record Problem(Severity severity, String message, SourcePosition position, String diagnosticCode) {

    public Problem {
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
        Objects.requireNonNull(position, "position cannot be null");
    }

    /**
     * Creates a problem without a diagnostic code.
     */
    public Problem(Severity severity, String message, SourcePosition position) {
        this(severity, message, position, null);
    }

    public static Problem error(String message, SourcePosition position) {
        return new Problem(Severity.ERROR, message, position);
    }

    public static Problem warning(String message, SourcePosition position) {
        return new Problem(Severity.WARNING, message, position);
    }

    public static Problem info(String message, SourcePosition position) {
        return new Problem(Severity.INFO, message, position);
    }
}
