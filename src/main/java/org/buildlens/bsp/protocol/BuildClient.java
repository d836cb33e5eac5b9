package org.buildlens.bsp.protocol;

/**
 * The receiving end of build notifications.
 * <p>
 * Implementations are called from compiler worker threads and must be thread-safe.
 */
public interface BuildClient {

    void onBuildPublishDiagnostics(PublishDiagnosticsParams params);

    void onBuildTaskStart(TaskStartParams params);

    void onBuildTaskFinish(TaskFinishParams params);
}
