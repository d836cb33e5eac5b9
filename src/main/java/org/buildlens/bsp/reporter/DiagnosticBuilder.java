package org.buildlens.bsp.reporter;

import org.buildlens.bsp.protocol.Diagnostic;
import org.buildlens.bsp.protocol.DiagnosticSeverity;
import org.buildlens.compiler.api.Problem;
import org.buildlens.compiler.api.Severity;

/**
 * Builds protocol diagnostics from compiler problems.
 */
public final class DiagnosticBuilder {

    /** The {@code source} tag of every diagnostic this tool publishes. */
    public static final String SOURCE = "buildlens";

    private DiagnosticBuilder() {}

    /**
     * Builds the diagnostic for a problem.
     *
     * @param problem The compiler problem.
     * @return The diagnostic, carrying the problem's code if it has one.
     */
    public static Diagnostic build(Problem problem) {
        return new Diagnostic(
                PositionMapper.toRange(problem.position()),
                problem.message(),
                toSeverity(problem.severity()),
                SOURCE,
                problem.diagnosticCode());
    }

    static DiagnosticSeverity toSeverity(Severity severity) {
        return switch (severity) {
            case INFO -> DiagnosticSeverity.INFORMATION;
            case WARNING -> DiagnosticSeverity.WARNING;
            case ERROR -> DiagnosticSeverity.ERROR;
        };
    }
}
