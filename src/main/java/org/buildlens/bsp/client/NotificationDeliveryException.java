package org.buildlens.bsp.client;

/**
 * Thrown when a notification cannot be handed to its destination.
 */
public class NotificationDeliveryException extends RuntimeException {

    /**
     * @param message The detail message.
     * @param cause   The underlying failure.
     */
    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
