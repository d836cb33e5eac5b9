package org.buildlens.bsp.protocol;

import java.util.Objects;

/**
 * A span in a text document. A range whose start equals its end denotes a single point.
 *
 * @param start The start position.
 * @param end   The end position.
 */
public record Range(Position start, Position end) {

    public Range {
        Objects.requireNonNull(start, "start cannot be null");
        Objects.requireNonNull(end, "end cannot be null");
    }

    public static Range point(int line, int character) {
        Position position = new Position(line, character);
        return new Range(position, position);
    }
}
