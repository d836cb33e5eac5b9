package org.buildlens.bsp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Notification that a task has finished.
 *
 * @param taskId    The task.
 * @param eventTime Epoch milliseconds of the event.
 * @param message   Human-readable message.
 * @param status    The outcome.
 * @param dataKind  Kind of {@code data}, see {@link TaskDataKind}.
 * @param data      Kind-specific payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskFinishParams(TaskId taskId, Long eventTime, String message, StatusCode status, String dataKind, Object data) {}
