package org.buildlens.bsp.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Diagnostic severities as defined by the protocol. Serialized as their integer code.
 */
public enum DiagnosticSeverity {
    ERROR(1),
    WARNING(2),
    INFORMATION(3),
    HINT(4);

    private final int value;

    DiagnosticSeverity(int value) {
        this.value = value;
    }

    @JsonValue
    public int getValue() {
        return value;
    }

    @JsonCreator
    public static DiagnosticSeverity forValue(int value) {
        for (DiagnosticSeverity severity : values()) {
            if (severity.value == value) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown diagnostic severity: " + value);
    }
}
