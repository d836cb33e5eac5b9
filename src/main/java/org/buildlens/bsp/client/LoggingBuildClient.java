package org.buildlens.bsp.client;

import org.buildlens.bsp.protocol.BuildClient;
import org.buildlens.bsp.protocol.Diagnostic;
import org.buildlens.bsp.protocol.DiagnosticSeverity;
import org.buildlens.bsp.protocol.PublishDiagnosticsParams;
import org.buildlens.bsp.protocol.StatusCode;
import org.buildlens.bsp.protocol.TaskFinishParams;
import org.buildlens.bsp.protocol.TaskStartParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders notifications as log lines, for running without a connected client.
 * <p>
 * Only the newest diagnostic of each publish notification is logged, since the earlier
 * ones were logged when they were first published.
 */
public class LoggingBuildClient implements BuildClient {

    private static final Logger log = LoggerFactory.getLogger(LoggingBuildClient.class);

    @Override
    public void onBuildPublishDiagnostics(PublishDiagnosticsParams params) {
        if (params.diagnostics().isEmpty()) {
            log.debug("{}: no diagnostics", params.textDocument().uri());
            return;
        }
        Diagnostic latest = params.diagnostics().get(params.diagnostics().size() - 1);
        String line = format(params, latest);
        if (latest.severity() == DiagnosticSeverity.ERROR) {
            log.warn(line);
        } else {
            log.info(line);
        }
    }

    @Override
    public void onBuildTaskStart(TaskStartParams params) {
        log.info("[{}] {}", params.taskId().id(), params.message());
    }

    @Override
    public void onBuildTaskFinish(TaskFinishParams params) {
        if (params.status() == StatusCode.ERROR) {
            log.warn("[{}] {} ({})", params.taskId().id(), params.message(), params.status());
        } else {
            log.info("[{}] {} ({})", params.taskId().id(), params.message(), params.status());
        }
    }

    static String format(PublishDiagnosticsParams params, Diagnostic diagnostic) {
        String severity = diagnostic.severity() != null ? diagnostic.severity().name() : "UNKNOWN";
        String code = diagnostic.code() != null ? " [" + diagnostic.code() + "]" : "";
        return String.format("[%s] %s:%d:%d: %s%s",
                severity,
                params.textDocument().uri(),
                diagnostic.range().start().line() + 1,
                diagnostic.range().start().character(),
                diagnostic.message(),
                code);
    }
}
