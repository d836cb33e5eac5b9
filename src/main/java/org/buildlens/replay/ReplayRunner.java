package org.buildlens.replay;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.buildlens.bsp.protocol.BuildClient;
import org.buildlens.bsp.protocol.BuildTargetIdentifier;
import org.buildlens.bsp.protocol.StatusCode;
import org.buildlens.bsp.protocol.TaskId;
import org.buildlens.bsp.reporter.BspCompileProblemReporter;
import org.buildlens.compiler.api.Problem;
import org.buildlens.compiler.api.SourcePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Feeds a {@link ReplayScript} through a {@link BspCompileProblemReporter}.
 * <p>
 * Relative file paths in the script are resolved against a base directory, normally the
 * directory containing the script. If the script never finishes the task, the runner
 * finishes it after the last event.
 */
public class ReplayRunner {

    private static final Logger log = LoggerFactory.getLogger(ReplayRunner.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private final Clock clock;

    public ReplayRunner() {
        this(Clock.systemUTC());
    }

    public ReplayRunner(Clock clock) {
        this.clock = clock;
    }

    /**
     * Reads a script from a JSON file.
     *
     * @param scriptFile The script file.
     * @return The parsed script.
     * @throws ReplayException if the file cannot be read or parsed.
     */
    public ReplayScript read(Path scriptFile) throws ReplayException {
        try {
            return mapper.readValue(scriptFile.toFile(), ReplayScript.class);
        } catch (IOException e) {
            throw new ReplayException("Failed to read replay script '" + scriptFile + "': " + e.getMessage(), e);
        }
    }

    /**
     * Replays a script.
     *
     * @param script           The script.
     * @param baseDirectory    Directory against which relative paths are resolved.
     * @param client           The client that receives the notifications.
     * @param fallbackDisplayName Display name to use when the script has none, or {@code null}
     *                         to derive it from the target URI.
     * @return The status the finish notification carried.
     * @throws ReplayException if an event is incomplete or names an invalid path.
     */
    public StatusCode replay(ReplayScript script, Path baseDirectory, BuildClient client, String fallbackDisplayName)
            throws ReplayException {
        String displayName = displayName(script.target(), fallbackDisplayName);
        BspCompileProblemReporter reporter = new BspCompileProblemReporter(
                client,
                new BuildTargetIdentifier(script.target().uri()),
                displayName,
                new TaskId(script.taskId()),
                script.originId(),
                clock);

        int index = 0;
        for (ReplayEvent event : script.events()) {
            apply(reporter, event, index++, baseDirectory);
        }
        if (!reporter.isFinished()) {
            log.debug("Script for {} has no finish event, finishing after {} events", displayName, index);
            reporter.finish();
        }
        return reporter.finishedStatus();
    }

    private void apply(BspCompileProblemReporter reporter, ReplayEvent event, int index, Path baseDirectory)
            throws ReplayException {
        if (event.type() == null) {
            throw new ReplayException("Event #" + index + " has no type");
        }
        switch (event.type()) {
            case START -> reporter.start();
            case PROBLEM -> reporter.logProblem(toProblem(event, index, baseDirectory));
            case FILE_VISITED -> {
                if (event.file() == null) {
                    throw new ReplayException("FILE_VISITED event #" + index + " has no file");
                }
                reporter.fileVisited(resolve(baseDirectory, event.file(), index));
            }
            case PRINT_SUMMARY -> reporter.printSummary();
            case FINISH -> reporter.finish();
        }
    }

    private Problem toProblem(ReplayEvent event, int index, Path baseDirectory) throws ReplayException {
        if (event.severity() == null || event.message() == null) {
            throw new ReplayException("PROBLEM event #" + index + " needs a severity and a message");
        }
        return new Problem(event.severity(), event.message(), toPosition(event.position(), baseDirectory, index),
                event.diagnosticCode());
    }

    static SourcePosition toPosition(ReplayEvent.RecordedPosition recorded, Path baseDirectory, int index)
            throws ReplayException {
        if (recorded == null) {
            return SourcePosition.UNKNOWN;
        }
        return SourcePosition.builder()
                .sourceFile(recorded.sourceFile() != null ? resolve(baseDirectory, recorded.sourceFile(), index) : null)
                .line(recorded.line())
                .startLine(recorded.startLine())
                .startColumn(recorded.startColumn())
                .endLine(recorded.endLine())
                .endColumn(recorded.endColumn())
                .pointer(recorded.pointer())
                .build();
    }

    private static Path resolve(Path baseDirectory, String file, int index) throws ReplayException {
        try {
            return baseDirectory.resolve(file);
        } catch (InvalidPathException e) {
            throw new ReplayException("Event #" + index + " has an invalid path '" + file + "': " + e.getReason(), e);
        }
    }

    static String displayName(ReplayScript.Target target, String fallback) {
        if (target.displayName() != null && !target.displayName().isBlank()) {
            return target.displayName();
        }
        if (fallback != null && !fallback.isBlank()) {
            return fallback;
        }
        String uri = target.uri();
        while (uri.endsWith("/")) {
            uri = uri.substring(0, uri.length() - 1);
        }
        int slash = uri.lastIndexOf('/');
        int query = uri.lastIndexOf('?');
        if (query > slash) {
            // e.g. file:///ws/?id=core
            return uri.substring(query + 1).replaceFirst("^id=", "");
        }
        return slash >= 0 ? uri.substring(slash + 1) : uri;
    }
}
