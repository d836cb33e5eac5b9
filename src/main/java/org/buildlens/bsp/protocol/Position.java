package org.buildlens.bsp.protocol;

/**
 * A 0-based position in a text document.
 *
 * @param line      The 0-based line.
 * @param character The 0-based column.
 */
public record Position(int line, int character) {}
