package com.jay.formulaengine.notification;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live notification channels per user. Owned by the application context: created at start-up,
 * cleared on shutdown, and injected wherever notifications are pushed.
 */
@Slf4j
@Component
public class ConnectionRegistry {

    private final Map<String, List<NotificationChannel>> channels = new ConcurrentHashMap<>();

    public void register(String userId, NotificationChannel channel) {
        List<NotificationChannel> userChannels = channels.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>());
        userChannels.removeIf(c -> c.name().equals(channel.name()));
        userChannels.add(channel);
        log.info("Channel {} registered for user {}", channel.name(), userId);
    }

    public void unregister(String userId, String channelName) {
        List<NotificationChannel> userChannels = channels.get(userId);
        if (userChannels != null && userChannels.removeIf(c -> c.name().equals(channelName))) {
            log.info("Channel {} unregistered for user {}", channelName, userId);
        }
    }

    public List<NotificationChannel> channelsFor(String userId) {
        if (userId == null) return List.of();
        return List.copyOf(channels.getOrDefault(userId, List.of()));
    }

    public Set<String> connectedUsers() {
        return Set.copyOf(channels.keySet());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} user channel registrations", channels.size());
        channels.clear();
    }
}
