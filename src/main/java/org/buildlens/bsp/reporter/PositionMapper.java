package org.buildlens.bsp.reporter;

import org.buildlens.bsp.protocol.Position;
import org.buildlens.bsp.protocol.Range;
import org.buildlens.compiler.api.SourcePosition;

/**
 * Converts compiler positions (1-based lines) into protocol ranges (0-based lines).
 * <p>
 * Each field falls back independently: an explicit span wins over {@code line},
 * and {@code pointer} stands in for missing columns. A missing end collapses onto the
 * start, so a position with only a pointer becomes a zero-width range.
 */
public final class PositionMapper {

    private PositionMapper() {}

    /**
     * Maps a compiler position to a protocol range.
     *
     * @param position The compiler position.
     * @return The corresponding 0-based range.
     */
    public static Range toRange(SourcePosition position) {
        Integer line = correctLine(position.line());

        int startLine = firstPresent(correctLine(position.startLine()), line, 0);
        int startCharacter = firstPresent(position.startColumn(), position.pointer(), 0);
        // end falls back to the start resolved above
        int endLine = firstPresent(correctLine(position.endLine()), line, startLine);
        int endCharacter = firstPresent(position.endColumn(), position.pointer(), startCharacter);

        return new Range(new Position(startLine, startCharacter), new Position(endLine, endCharacter));
    }

    private static Integer correctLine(Integer oneBasedLine) {
        return oneBasedLine == null ? null : oneBasedLine - 1;
    }

    private static int firstPresent(Integer preferred, Integer fallback, int defaultValue) {
        if (preferred != null) {
            return preferred;
        }
        return fallback != null ? fallback : defaultValue;
    }
}
