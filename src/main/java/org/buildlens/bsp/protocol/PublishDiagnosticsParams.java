package org.buildlens.bsp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Notification carrying the diagnostics of one document.
 * <p>
 * With {@code reset == true} the list is the complete current set for the document,
 * replacing whatever the receiver showed before.
 *
 * @param textDocument The document.
 * @param buildTarget  The target whose compilation produced the diagnostics.
 * @param diagnostics  The diagnostics, in publication order.
 * @param reset        Whether the list replaces previous diagnostics.
 * @param originId     The origin id of the compile request, or {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PublishDiagnosticsParams(
        TextDocumentIdentifier textDocument,
        BuildTargetIdentifier buildTarget,
        List<Diagnostic> diagnostics,
        boolean reset,
        String originId
) {

    public PublishDiagnosticsParams {
        Objects.requireNonNull(textDocument, "textDocument cannot be null");
        Objects.requireNonNull(buildTarget, "buildTarget cannot be null");
        diagnostics = List.copyOf(diagnostics);
    }
}
