package org.buildlens.replay;

/**
 * Thrown when a replay script cannot be read or contains an invalid event.
 */
public class ReplayException extends Exception {

    public ReplayException(String message) {
        super(message);
    }

    public ReplayException(String message, Throwable cause) {
        super(message, cause);
    }
}
