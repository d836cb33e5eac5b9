package org.buildlens.bsp.protocol;

/**
 * Payload of a task start notification for a compilation.
 *
 * @param target The target being compiled.
 */
public record CompileTask(BuildTargetIdentifier target) {}
