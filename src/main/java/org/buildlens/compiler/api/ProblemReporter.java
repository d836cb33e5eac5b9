package org.buildlens.compiler.api;

import java.nio.file.Path;

/**
 * The contract a compiler uses to report problems and the lifecycle of one compilation.
 * <p>
 * Implementations must tolerate concurrent calls from several compiler worker threads.
 * {@link #start()} and {@link #finish()} may be called more than once; only the first
 * call of each has an effect.
 */
public interface ProblemReporter {

    /**
     * Signals that the compilation has started.
     */
    void start();

    /**
     * Reports an error.
     * @param problem The problem to report.
     */
    void logError(Problem problem);

    /**
     * Reports a warning.
     * @param problem The problem to report.
     */
    void logWarning(Problem problem);

    /**
     * Reports an informational message.
     * @param problem The problem to report.
     */
    void logInfo(Problem problem);

    /**
     * Signals that the compiler has processed the given file, regardless of whether it
     * produced any problems.
     * @param file The visited file.
     */
    void fileVisited(Path file);

    /**
     * Prints a summary of the compilation. Compilers call this once at the end of a run.
     */
    void printSummary();

    /**
     * Signals that the compilation has finished.
     */
    void finish();

    /**
     * Reports a problem through the entry point matching its own severity.
     * @param problem The problem to report.
     */
    default void logProblem(Problem problem) {
        switch (problem.severity()) {
            case ERROR -> logError(problem);
            case WARNING -> logWarning(problem);
            case INFO -> logInfo(problem);
        }
    }
}
