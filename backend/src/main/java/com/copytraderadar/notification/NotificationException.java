package com.copytraderadar.notification;

/**
 * Outbound transport failure. Always caught by the dispatcher; never reaches the webhook response.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
