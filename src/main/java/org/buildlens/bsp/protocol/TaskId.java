package org.buildlens.bsp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * Correlates the notifications of one task.
 *
 * @param id      The unique task id.
 * @param parents Ids of enclosing tasks, or {@code null}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskId(String id, List<String> parents) {

    public TaskId {
        Objects.requireNonNull(id, "id cannot be null");
        parents = parents == null ? null : List.copyOf(parents);
    }

    public TaskId(String id) {
        this(id, null);
    }
}
