package com.copytraderadar.notification;

/**
 * Outbound chat transport.
 */
public interface NotificationChannel {

    /**
     * False when the channel cannot send at all (e.g. missing credential).
     */
    boolean isAvailable();

    /**
     * Deliver one formatted message.
     *
     * @throws NotificationException on any transport failure
     */
    void send(String formattedMessage);
}
