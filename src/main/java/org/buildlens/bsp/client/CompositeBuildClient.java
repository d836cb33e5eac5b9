package org.buildlens.bsp.client;

import org.buildlens.bsp.protocol.BuildClient;
import org.buildlens.bsp.protocol.PublishDiagnosticsParams;
import org.buildlens.bsp.protocol.TaskFinishParams;
import org.buildlens.bsp.protocol.TaskStartParams;

import java.util.List;

/**
 * Forwards every notification to several clients, in the order they were given.
 */
public class CompositeBuildClient implements BuildClient {

    private final List<BuildClient> delegates;

    public CompositeBuildClient(List<BuildClient> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public CompositeBuildClient(BuildClient... delegates) {
        this(List.of(delegates));
    }

    @Override
    public void onBuildPublishDiagnostics(PublishDiagnosticsParams params) {
        delegates.forEach(client -> client.onBuildPublishDiagnostics(params));
    }

    @Override
    public void onBuildTaskStart(TaskStartParams params) {
        delegates.forEach(client -> client.onBuildTaskStart(params));
    }

    @Override
    public void onBuildTaskFinish(TaskFinishParams params) {
        delegates.forEach(client -> client.onBuildTaskFinish(params));
    }
}
