package org.buildlens.compiler.api;

import java.nio.file.Path;

/**
 * A position in the source code as reported by the compiler.
 * <p>
 * All line numbers are 1-based. Every field is optional and {@code null} when the compiler
 * did not provide it. A problem that is not tied to a file (e.g. a target-level message)
 * has a {@code null} {@link #sourceFile()}.
 *
 * @param sourceFile  The file the problem refers to, or {@code null}.
 * @param line        The 1-based line of the problem.
 * @param startLine   The 1-based first line of the problem span.
 * @param startColumn The 0-based first column of the problem span.
 * @param endLine     The 1-based last line of the problem span.
 * @param endColumn   The 0-based column where the problem span ends.
 * @param pointer     The 0-based column the compiler points at when no span is known.
 */
public record SourcePosition(
        Path sourceFile,
        Integer line,
        Integer startLine,
        Integer startColumn,
        Integer endLine,
        Integer endColumn,
        Integer pointer
) {

    /** A position that carries no information at all. */
    public static final SourcePosition UNKNOWN = builder().build();

    /**
     * @return {@code true} if this position refers to a source file.
     */
    public boolean hasSourceFile() {
        return sourceFile != null;
    }

    /**
     * Creates a builder for positions, starting from {@link #UNKNOWN}.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a position pointing at a single column of a line.
     *
     * @param sourceFile The file, may be {@code null}.
     * @param line       The 1-based line.
     * @param pointer    The 0-based column.
     * @return The position.
     */
    public static SourcePosition at(Path sourceFile, int line, int pointer) {
        return builder().sourceFile(sourceFile).line(line).pointer(pointer).build();
    }

    /**
     * Fluent builder, since compilers fill in widely varying subsets of the fields.
     */
    public static final class Builder {
        private Path sourceFile;
        private Integer line;
        private Integer startLine;
        private Integer startColumn;
        private Integer endLine;
        private Integer endColumn;
        private Integer pointer;

        private Builder() {}

        public Builder sourceFile(Path sourceFile) { this.sourceFile = sourceFile; return this; }
        public Builder line(Integer line) { this.line = line; return this; }
        public Builder startLine(Integer startLine) { this.startLine = startLine; return this; }
        public Builder startColumn(Integer startColumn) { this.startColumn = startColumn; return this; }
        public Builder endLine(Integer endLine) { this.endLine = endLine; return this; }
        public Builder endColumn(Integer endColumn) { this.endColumn = endColumn; return this; }
        public Builder pointer(Integer pointer) { this.pointer = pointer; return this; }

        public SourcePosition build() {
            return new SourcePosition(sourceFile, line, startLine, startColumn, endLine, endColumn, pointer);
        }
    }
}
