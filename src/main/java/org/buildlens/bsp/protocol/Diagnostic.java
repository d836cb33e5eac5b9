package org.buildlens.bsp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A single positioned issue about a text document.
 *
 * @param range    The span the diagnostic applies to.
 * @param message  The message.
 * @param severity The severity.
 * @param source   The tool that produced the diagnostic.
 * @param code     An optional tool-specific code, or {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Diagnostic(Range range, String message, DiagnosticSeverity severity, String source, String code) {

    public Diagnostic {
        Objects.requireNonNull(range, "range cannot be null");
        Objects.requireNonNull(message, "message cannot be null");
    }
}
