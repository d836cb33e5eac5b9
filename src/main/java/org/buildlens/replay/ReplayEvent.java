package org.buildlens.replay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.buildlens.compiler.api.Severity;

/**
 * One recorded reporter call. Only the fields relevant to the event type are set.
 *
 * @param type           The kind of call.
 * @param severity       Severity of a {@link Type#PROBLEM}.
 * @param message        Message of a {@link Type#PROBLEM}.
 * @param position       Position of a {@link Type#PROBLEM}, or {@code null}.
 * @param diagnosticCode Code of a {@link Type#PROBLEM}, or {@code null}.
 * @param file           File of a {@link Type#FILE_VISITED}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReplayEvent(
        Type type,
        Severity severity,
        String message,
        RecordedPosition position,
        String diagnosticCode,
        String file
) {

    public enum Type {
        START,
        PROBLEM,
        FILE_VISITED,
        PRINT_SUMMARY,
        FINISH
    }

    /**
     * A position as written in a script; {@code sourceFile} may be relative to the script.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RecordedPosition(
            String sourceFile,
            Integer line,
            Integer startLine,
            Integer startColumn,
            Integer endLine,
            Integer endColumn,
            Integer pointer
    ) {}
}
