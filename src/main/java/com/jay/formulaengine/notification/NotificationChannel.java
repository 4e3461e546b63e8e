package com.jay.formulaengine.notification;

/**
 * One live delivery path to a user (a Telegram chat, a push connection, ...).
 */
public interface NotificationChannel {

    String name();

    /** @return true when the message was accepted for delivery */
    boolean send(String message);
}
