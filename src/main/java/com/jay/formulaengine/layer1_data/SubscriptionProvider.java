package com.jay.formulaengine.layer1_data;

import com.jay.formulaengine.model.Subscription;

import java.util.List;

/**
 * Supplies the (subscription, formula) pairs the engine evaluates.
 * Each call returns a snapshot; later changes do not affect a list already handed out.
 */
public interface SubscriptionProvider {

    /** Subscriptions whose own flag and formula flag are both active. */
    List<Subscription> activeSubscriptions();

    List<Subscription> subscriptionsForUser(String userId);
}
