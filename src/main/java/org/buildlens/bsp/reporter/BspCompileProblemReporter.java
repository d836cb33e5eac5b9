package org.buildlens.bsp.reporter;

import org.buildlens.bsp.protocol.BuildClient;
import org.buildlens.bsp.protocol.BuildTargetIdentifier;
import org.buildlens.bsp.protocol.CompileReport;
import org.buildlens.bsp.protocol.CompileTask;
import org.buildlens.bsp.protocol.Diagnostic;
import org.buildlens.bsp.protocol.PublishDiagnosticsParams;
import org.buildlens.bsp.protocol.StatusCode;
import org.buildlens.bsp.protocol.TaskDataKind;
import org.buildlens.bsp.protocol.TaskFinishParams;
import org.buildlens.bsp.protocol.TaskId;
import org.buildlens.bsp.protocol.TaskStartParams;
import org.buildlens.bsp.protocol.TextDocumentIdentifier;
import org.buildlens.compiler.api.Problem;
import org.buildlens.compiler.api.ProblemReporter;
import org.buildlens.compiler.api.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Reports the problems of one target compilation to a {@link BuildClient}.
 * <p>
 * Every logged problem is published immediately, together with all earlier diagnostics of
 * the same document, as a {@code reset} notification. Problems without a source file are
 * published against the target's own URI. A compile-task start and a compile-report finish
 * notification bracket the diagnostics; each is sent at most once no matter how often or
 * from how many threads {@link #start()} and {@link #finish()} are called.
 * <p>
 * <strong>Thread Safety:</strong> all methods may be called concurrently by compiler worker
 * threads. No lock is held while the client is notified.
 * <p>
 * One instance covers exactly one compilation task and is discarded after {@link #finish()}.
 */
public class BspCompileProblemReporter implements ProblemReporter {

    private static final Logger log = LoggerFactory.getLogger(BspCompileProblemReporter.class);

    private final BuildClient client;
    private final BuildTargetIdentifier targetId;
    private final String targetDisplayName;
    private final TaskId taskId;
    private final String originId;
    private final Clock clock;

    private final DiagnosticStore store = new DiagnosticStore();
    private final ProblemCounters counters = new ProblemCounters();
    private final TaskLifecycle lifecycle = new TaskLifecycle();
    private volatile StatusCode finishedStatus;

    /**
     * Creates a reporter that stamps notifications with the system clock.
     *
     * @param client            The client to notify.
     * @param targetId          The target being compiled.
     * @param targetDisplayName The target name used in task messages.
     * @param taskId            The id of the compilation task.
     * @param originId          The origin id of the compile request, or {@code null}.
     */
    public BspCompileProblemReporter(BuildClient client,
                                     BuildTargetIdentifier targetId,
                                     String targetDisplayName,
                                     TaskId taskId,
                                     String originId) {
        this(client, targetId, targetDisplayName, taskId, originId, Clock.systemUTC());
    }

    /**
     * Creates a reporter.
     *
     * @param client            The client to notify.
     * @param targetId          The target being compiled.
     * @param targetDisplayName The target name used in task messages.
     * @param taskId            The id of the compilation task.
     * @param originId          The origin id of the compile request, or {@code null}.
     * @param clock             The clock for event timestamps.
     */
    public BspCompileProblemReporter(BuildClient client,
                                     BuildTargetIdentifier targetId,
                                     String targetDisplayName,
                                     TaskId taskId,
                                     String originId,
                                     Clock clock) {
        this.client = Objects.requireNonNull(client, "client cannot be null");
        this.targetId = Objects.requireNonNull(targetId, "targetId cannot be null");
        this.targetDisplayName = Objects.requireNonNull(targetDisplayName, "targetDisplayName cannot be null");
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
        this.originId = originId;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public void start() {
        if (!lifecycle.tryStart()) {
            log.debug("Task {} already started, ignoring start()", taskId.id());
            return;
        }
        log.info("Compiling target {}", targetDisplayName);
        client.onBuildTaskStart(new TaskStartParams(
                taskId,
                clock.millis(),
                "Compiling target " + targetDisplayName,
                TaskDataKind.COMPILE_TASK,
                new CompileTask(targetId)));
    }

    @Override
    public void logError(Problem problem) {
        report(problem, Severity.ERROR);
    }

    @Override
    public void logWarning(Problem problem) {
        report(problem, Severity.WARNING);
    }

    @Override
    public void logInfo(Problem problem) {
        report(problem, Severity.INFO);
    }

    @Override
    public void fileVisited(Path file) {
        TextDocumentIdentifier document = new TextDocumentIdentifier(file.toUri().toString());
        List<Diagnostic> diagnostics = store.ensure(document);
        log.trace("Visited {} with {} diagnostics", document.uri(), diagnostics.size());
        client.onBuildPublishDiagnostics(publishParams(document, diagnostics));
    }

    @Override
    public void printSummary() {
        finish();
    }

    @Override
    public void finish() {
        if (!lifecycle.tryFinish()) {
            log.debug("Task {} already finished, ignoring finish()", taskId.id());
            return;
        }
        int errors = counters.errors();
        int warnings = counters.warnings();
        StatusCode status = errors > 0 ? StatusCode.ERROR : StatusCode.OK;
        finishedStatus = status;
        log.info("Compiled {}: {} errors, {} warnings, {} infos", targetDisplayName, errors, warnings, counters.infos());
        client.onBuildTaskFinish(new TaskFinishParams(
                taskId,
                clock.millis(),
                "Compiled " + targetDisplayName,
                status,
                TaskDataKind.COMPILE_REPORT,
                new CompileReport(targetId, originId, errors, warnings, null)));
    }

    /**
     * @return The number of errors reported so far.
     */
    public int errorCount() {
        return counters.errors();
    }

    /**
     * @return The number of warnings reported so far.
     */
    public int warningCount() {
        return counters.warnings();
    }

    /**
     * @return The number of informational messages reported so far.
     */
    public int infoCount() {
        return counters.infos();
    }

    public boolean hasErrors() {
        return counters.errors() > 0;
    }

    /**
     * @return The status a finish notification would carry right now.
     */
    public StatusCode statusCode() {
        return hasErrors() ? StatusCode.ERROR : StatusCode.OK;
    }

    /**
     * Problems logged after {@link #finish()} still change {@link #statusCode()}, but never
     * this value.
     *
     * @return The status carried by the finish notification, or {@code null} before finish.
     */
    public StatusCode finishedStatus() {
        return finishedStatus;
    }

    /**
     * @param document The document.
     * @return The diagnostics published so far for the document.
     */
    public List<Diagnostic> diagnostics(TextDocumentIdentifier document) {
        return store.get(document);
    }

    public boolean isStarted() {
        return lifecycle.isStarted();
    }

    public boolean isFinished() {
        return lifecycle.isFinished();
    }

    private void report(Problem problem, Severity counted) {
        Diagnostic diagnostic = DiagnosticBuilder.build(problem);
        TextDocumentIdentifier document = documentOf(problem);
        List<Diagnostic> diagnostics = store.append(document, diagnostic);
        if (log.isDebugEnabled()) {
            log.debug("[{}] {} {}:{} {}", counted, targetDisplayName, document.uri(),
                    diagnostic.range().start().line() + 1, problem.message());
        }
        client.onBuildPublishDiagnostics(publishParams(document, diagnostics));
        counters.increment(counted);
    }

    private TextDocumentIdentifier documentOf(Problem problem) {
        Path sourceFile = problem.position().sourceFile();
        return new TextDocumentIdentifier(sourceFile != null ? sourceFile.toUri().toString() : targetId.uri());
    }

    private PublishDiagnosticsParams publishParams(TextDocumentIdentifier document, List<Diagnostic> diagnostics) {
        return new PublishDiagnosticsParams(document, targetId, diagnostics, true, originId);
    }
}
