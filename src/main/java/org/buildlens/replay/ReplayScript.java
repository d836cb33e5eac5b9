package org.buildlens.replay;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * A recorded compilation: the target, the task and the sequence of reporter calls.
 *
 * @param target   The compiled target.
 * @param taskId   The id of the compilation task.
 * @param originId The origin id of the compile request, or {@code null}.
 * @param events   The reporter calls in recorded order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReplayScript(Target target, String taskId, String originId, List<ReplayEvent> events) {

    public ReplayScript {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(taskId, "taskId cannot be null");
        events = events == null ? List.of() : List.copyOf(events);
    }

    /**
     * @param uri         The target URI.
     * @param displayName The name used in task messages, or {@code null}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Target(String uri, String displayName) {

        public Target {
            Objects.requireNonNull(uri, "target uri cannot be null");
        }
    }
}
