package com.jay.formulaengine.layer1_data;

import com.jay.formulaengine.model.Subscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory subscription store fed through the operator API.
 */
@Slf4j
@Component
public class SubscriptionRegistry implements SubscriptionProvider {

    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    public Subscription register(Subscription subscription) {
        Subscription stored = subscription.getId() == null || subscription.getId().isBlank()
            ? subscription.toBuilder().id("SUB-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase()).build()
            : subscription;
        subscriptions.put(stored.getId(), stored);
        log.info("Subscription {} registered: user={} formula={} mode={}", stored.getId(), stored.getUserId(),
            stored.getFormula() != null ? stored.getFormula().getId() : null, stored.effectiveExecutionMode());
        return stored;
    }

    public boolean remove(String subscriptionId) {
        boolean removed = subscriptions.remove(subscriptionId) != null;
        if (removed) log.info("Subscription {} removed", subscriptionId);
        return removed;
    }

    public Optional<Subscription> find(String subscriptionId) {
        return Optional.ofNullable(subscriptions.get(subscriptionId));
    }

    /** The subscription binding a user to a formula, active or not. */
    public Optional<Subscription> find(String userId, String formulaId) {
        return subscriptions.values().stream()
            .filter(s -> userId.equals(s.getUserId()))
            .filter(s -> s.getFormula() != null && formulaId.equals(s.getFormula().getId()))
            .findFirst();
    }

    public List<Subscription> all() {
        return new ArrayList<>(subscriptions.values());
    }

    @Override
    public List<Subscription> activeSubscriptions() {
        return subscriptions.values().stream().filter(Subscription::isEvaluable).toList();
    }

    @Override
    public List<Subscription> subscriptionsForUser(String userId) {
        return subscriptions.values().stream()
            .filter(s -> userId.equals(s.getUserId()))
            .toList();
    }
}
