package org.buildlens.bsp.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Coarse outcome of a task. Serialized as its integer code.
 */
public enum StatusCode {
    OK(1),
    ERROR(2),
    CANCELLED(3);

    private final int value;

    StatusCode(int value) {
        this.value = value;
    }

    @JsonValue
    public int getValue() {
        return value;
    }

    @JsonCreator
    public static StatusCode forValue(int value) {
        for (StatusCode code : values()) {
            if (code.value == value) {
                return code;
            }
        }
        throw new IllegalArgumentException("Unknown status code: " + value);
    }
}
