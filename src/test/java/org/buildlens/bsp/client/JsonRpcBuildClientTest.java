package org.buildlens.bsp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.buildlens.bsp.protocol.BuildTargetIdentifier;
import org.buildlens.bsp.protocol.CompileReport;
import org.buildlens.bsp.protocol.CompileTask;
import org.buildlens.bsp.protocol.Diagnostic;
import org.buildlens.bsp.protocol.DiagnosticSeverity;
import org.buildlens.bsp.protocol.Position;
import org.buildlens.bsp.protocol.PublishDiagnosticsParams;
import org.buildlens.bsp.protocol.Range;
import org.buildlens.bsp.protocol.StatusCode;
import org.buildlens.bsp.protocol.TaskDataKind;
import org.buildlens.bsp.protocol.TaskFinishParams;
import org.buildlens.bsp.protocol.TaskId;
import org.buildlens.bsp.protocol.TaskStartParams;
import org.buildlens.bsp.protocol.TextDocumentIdentifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class JsonRpcBuildClientTest {

    private static final BuildTargetIdentifier TARGET = new BuildTargetIdentifier("file:///ws/?id=core");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private StringWriter out;
    private JsonRpcBuildClient client;

    @BeforeEach
    void setup() {
        out = new StringWriter();
        client = new JsonRpcBuildClient(out, false);
    }

    @Test
    void testPublishDiagnostics_WireShape() throws Exception {
        Diagnostic diagnostic = new Diagnostic(
                new Range(new Position(9, 2), new Position(9, 5)), "boom", DiagnosticSeverity.ERROR, "buildlens", "E1");

        client.onBuildPublishDiagnostics(new PublishDiagnosticsParams(
                new TextDocumentIdentifier("file:///ws/A.java"), TARGET, List.of(diagnostic), true, "origin-1"));

        JsonNode json = singleLine();
        assertThat(json.get("jsonrpc").asText()).isEqualTo("2.0");
        assertThat(json.get("method").asText()).isEqualTo(JsonRpcBuildClient.PUBLISH_DIAGNOSTICS);
        JsonNode params = json.get("params");
        assertThat(params.get("textDocument").get("uri").asText()).isEqualTo("file:///ws/A.java");
        assertThat(params.get("buildTarget").get("uri").asText()).isEqualTo(TARGET.uri());
        assertThat(params.get("reset").asBoolean()).isTrue();
        assertThat(params.get("originId").asText()).isEqualTo("origin-1");
        JsonNode d = params.get("diagnostics").get(0);
        assertThat(d.get("range").get("start").get("line").asInt()).isEqualTo(9);
        assertThat(d.get("range").get("end").get("character").asInt()).isEqualTo(5);
        assertThat(d.get("severity").asInt()).isEqualTo(1);
        assertThat(d.get("source").asText()).isEqualTo("buildlens");
        assertThat(d.get("code").asText()).isEqualTo("E1");
    }

    @Test
    void testRange_HasOnlyStartAndEnd() throws Exception {
        // Given
        Diagnostic diagnostic = new Diagnostic(Range.point(1, 2), "boom", DiagnosticSeverity.ERROR, "buildlens", null);

        // When
        client.onBuildPublishDiagnostics(new PublishDiagnosticsParams(
                new TextDocumentIdentifier("file:///ws/A.java"), TARGET, List.of(diagnostic), true, null));

        // Then
        JsonNode range = singleLine().at("/params/diagnostics/0/range");
        List<String> fields = new ArrayList<>();
        range.fieldNames().forEachRemaining(fields::add);
        assertThat(fields).containsExactlyInAnyOrder("start", "end");
        for (String bound : fields) {
            List<String> positionFields = new ArrayList<>();
            range.get(bound).fieldNames().forEachRemaining(positionFields::add);
            assertThat(positionFields).containsExactlyInAnyOrder("line", "character");
        }
        assertThat(range.at("/start/line").asInt()).isEqualTo(1);
        assertThat(range.at("/end/character").asInt()).isEqualTo(2);
    }

    @Test
    void testNullFieldsAreOmitted() throws Exception {
        Diagnostic diagnostic = new Diagnostic(Range.point(0, 0), "note", DiagnosticSeverity.INFORMATION, "buildlens", null);

        client.onBuildPublishDiagnostics(new PublishDiagnosticsParams(
                new TextDocumentIdentifier(TARGET.uri()), TARGET, List.of(diagnostic), true, null));

        JsonNode params = singleLine().get("params");
        assertThat(params.has("originId")).isFalse();
        assertThat(params.get("diagnostics").get(0).has("code")).isFalse();
        assertThat(params.get("diagnostics").get(0).get("severity").asInt()).isEqualTo(3);
    }

    @Test
    void testTaskStartAndFinish() throws Exception {
        client.onBuildTaskStart(new TaskStartParams(
                new TaskId("task1"), 1000L, "Compiling target core", TaskDataKind.COMPILE_TASK, new CompileTask(TARGET)));
        client.onBuildTaskFinish(new TaskFinishParams(
                new TaskId("task1"), 2000L, "Compiled core", StatusCode.ERROR, TaskDataKind.COMPILE_REPORT,
                new CompileReport(TARGET, "o", 2, 1, null)));

        String[] lines = out.toString().split(System.lineSeparator());
        assertThat(lines).hasSize(2);

        JsonNode start = MAPPER.readTree(lines[0]);
        assertThat(start.get("method").asText()).isEqualTo(JsonRpcBuildClient.TASK_START);
        assertThat(start.at("/params/taskId/id").asText()).isEqualTo("task1");
        assertThat(start.at("/params/taskId").has("parents")).isFalse();
        assertThat(start.at("/params/dataKind").asText()).isEqualTo("compile-task");
        assertThat(start.at("/params/data/target/uri").asText()).isEqualTo(TARGET.uri());

        JsonNode finish = MAPPER.readTree(lines[1]);
        assertThat(finish.get("method").asText()).isEqualTo(JsonRpcBuildClient.TASK_FINISH);
        assertThat(finish.at("/params/status").asInt()).isEqualTo(2);
        assertThat(finish.at("/params/eventTime").asLong()).isEqualTo(2000L);
        assertThat(finish.at("/params/data/errors").asInt()).isEqualTo(2);
        assertThat(finish.at("/params/data/warnings").asInt()).isEqualTo(1);
        assertThat(finish.at("/params/data/originId").asText()).isEqualTo("o");
        assertThat(finish.at("/params/data").has("time")).isFalse();
    }

    @Test
    void testConcurrentWritesDoNotInterleave() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 200; i++) {
            final int n = i;
            executor.submit(() -> client.onBuildTaskStart(new TaskStartParams(
                    new TaskId("task-" + n), (long) n, "m", TaskDataKind.COMPILE_TASK, new CompileTask(TARGET))));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        String[] lines = out.toString().split(System.lineSeparator());
        assertThat(lines).hasSize(200);
        for (String line : lines) {
            assertThat(MAPPER.readTree(line).at("/params/taskId/id").asText()).startsWith("task-");
        }
    }

    @Test
    void testWriteFailure_IsWrapped() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("pipe closed");
            }

            @Override
            public void flush() {}

            @Override
            public void close() {}
        };
        JsonRpcBuildClient brokenClient = new JsonRpcBuildClient(broken, false);

        assertThatThrownBy(() -> brokenClient.onBuildTaskStart(new TaskStartParams(
                new TaskId("t"), 1L, "m", TaskDataKind.COMPILE_TASK, new CompileTask(TARGET))))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasMessageContaining(JsonRpcBuildClient.TASK_START)
                .hasRootCauseMessage("pipe closed");
    }

    @Test
    void testPrettyPrint_ProducesIndentedJson() throws Exception {
        StringWriter pretty = new StringWriter();
        new JsonRpcBuildClient(pretty, true).onBuildTaskStart(new TaskStartParams(
                new TaskId("t"), 1L, "m", TaskDataKind.COMPILE_TASK, new CompileTask(TARGET)));

        assertThat(pretty.toString().trim()).contains("\n");
        assertThat(MAPPER.readTree(pretty.toString()).get("method").asText()).isEqualTo(JsonRpcBuildClient.TASK_START);
    }

    private JsonNode singleLine() throws IOException {
        String[] lines = out.toString().split(System.lineSeparator());
        assertThat(lines).hasSize(1);
        return MAPPER.readTree(lines[0]);
    }
}
