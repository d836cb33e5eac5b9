package org.buildlens.bsp.protocol;

/**
 * Values of the {@code dataKind} field of task notifications.
 */
public final class TaskDataKind {

    public static final String COMPILE_TASK = "compile-task";
    public static final String COMPILE_REPORT = "compile-report";

    private TaskDataKind() {}
}
