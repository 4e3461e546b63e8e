package com.jay.formulaengine.notification;

import com.jay.formulaengine.model.enums.NotificationType;

import java.util.Map;

/**
 * Best-effort user notification. Implementations never throw; failures are logged and
 * reported through the return value.
 */
public interface NotificationDispatcher {

    /** @return true when at least one channel accepted the message */
    boolean notify(String userId, NotificationType type, Map<String, Object> payload);
}
