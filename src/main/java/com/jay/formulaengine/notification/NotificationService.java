package com.jay.formulaengine.notification;

import com.jay.formulaengine.layer5_report.NotificationMessageFormatter;
import com.jay.formulaengine.model.enums.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Pushes formatted notifications to every channel the user has registered and mirrors
 * them to the operator Telegram chat.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService implements NotificationDispatcher {

    private final ConnectionRegistry connections;
    private final TelegramService telegramService;
    private final NotificationMessageFormatter formatter;

    @Override
    public boolean notify(String userId, NotificationType type, Map<String, Object> payload) {
        String message;
        try {
            message = formatter.format(type, payload);
        } catch (Exception e) {
            log.warn("Could not format {} notification for {}: {}", type, userId, e.getMessage());
            return false;
        }

        boolean delivered = false;
        for (NotificationChannel channel : connections.channelsFor(userId)) {
            try {
                if (channel.send(message)) {
                    delivered = true;
                } else {
                    log.warn("{} notification to {} via {} not accepted", type, userId, channel.name());
                }
            } catch (Exception e) {
                log.warn("{} notification to {} via {} failed: {}", type, userId, channel.name(), e.getMessage());
            }
        }

        try {
            String operatorCopy = userId != null ? "👤 " + userId + "\n" + message : message;
            if (telegramService.sendMessage(operatorCopy)) delivered = true;
        } catch (Exception e) {
            log.warn("Operator copy of {} notification failed: {}", type, e.getMessage());
        }

        if (!delivered) {
            log.warn("{} notification for {} reached no channel", type, userId);
        }
        return delivered;
    }
}
