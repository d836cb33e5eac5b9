package org.buildlens.bsp.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.buildlens.bsp.protocol.BuildClient;
import org.buildlens.bsp.protocol.PublishDiagnosticsParams;
import org.buildlens.bsp.protocol.TaskFinishParams;
import org.buildlens.bsp.protocol.TaskStartParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * Writes every notification as a JSON-RPC 2.0 notification object, one per line.
 * <p>
 * Each line is written and flushed while holding the writer's monitor, so notifications
 * from concurrent callers never interleave.
 */
public class JsonRpcBuildClient implements BuildClient {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcBuildClient.class);

    public static final String PUBLISH_DIAGNOSTICS = "build/publishDiagnostics";
    public static final String TASK_START = "build/taskStart";
    public static final String TASK_FINISH = "build/taskFinish";

    private final Writer out;
    private final ObjectWriter writer;

    /**
     * @param out         Destination of the notification lines. Not closed by this client.
     * @param prettyPrint Whether to indent the JSON (each notification then spans several lines).
     */
    public JsonRpcBuildClient(Writer out, boolean prettyPrint) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
        ObjectMapper mapper = createMapper();
        this.writer = prettyPrint
                ? mapper.writer().with(SerializationFeature.INDENT_OUTPUT)
                : mapper.writer();
    }

    /**
     * Creates the mapper used for notifications. Null fields are omitted throughout.
     *
     * @return A configured mapper.
     */
    public static ObjectMapper createMapper() {
        return new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    public void onBuildPublishDiagnostics(PublishDiagnosticsParams params) {
        send(PUBLISH_DIAGNOSTICS, params);
    }

    @Override
    public void onBuildTaskStart(TaskStartParams params) {
        send(TASK_START, params);
    }

    @Override
    public void onBuildTaskFinish(TaskFinishParams params) {
        send(TASK_FINISH, params);
    }

    private void send(String method, Object params) {
        String json;
        try {
            json = writer.writeValueAsString(new Notification(method, params));
        } catch (JsonProcessingException e) {
            throw new NotificationDeliveryException("Failed to serialize " + method + " notification", e);
        }
        synchronized (out) {
            try {
                out.write(json);
                out.write(System.lineSeparator());
                out.flush();
            } catch (IOException e) {
                throw new NotificationDeliveryException("Failed to write " + method + " notification", e);
            }
        }
        log.trace("Sent {}", method);
    }

    /**
     * JSON-RPC notification envelope.
     */
    record Notification(String jsonrpc, String method, Object params) {
        Notification(String method, Object params) {
            this("2.0", method, params);
        }
    }
}
