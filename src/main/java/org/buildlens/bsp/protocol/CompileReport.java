package org.buildlens.bsp.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Payload of a task finish notification for a compilation.
 *
 * @param target   The compiled target.
 * @param originId The origin id of the compile request, or {@code null}.
 * @param errors   The number of errors reported.
 * @param warnings The number of warnings reported.
 * @param time     The compilation time in milliseconds, or {@code null} if not measured.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileReport(BuildTargetIdentifier target, String originId, int errors, int warnings, Long time) {}
