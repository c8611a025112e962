package com.qqsuccubus.delivery.core.subscribe;

import com.qqsuccubus.delivery.core.msg.EventEnvelope;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Handlers registered on a bus, in registration order.
 * <p>
 * Reads vastly outnumber writes, so dispatch iterates a copy-on-write snapshot and
 * (un)subscribing during a dispatch is safe.
 * </p>
 */
public class SubscriptionRegistry {
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();

    public String register(EventHandler handler, EventFilter filter) {
        Objects.requireNonNull(handler, "handler");
        String id = UUID.randomUUID().toString();
        subscriptions.add(new Subscription(id, handler, filter == null ? EventFilter.all() : filter));
        return id;
    }

    public boolean unregister(String subscriptionId) {
        return subscriptions.removeIf(s -> s.id().equals(subscriptionId));
    }

    public List<Subscription> matching(EventEnvelope envelope) {
        List<Subscription> result = new ArrayList<>();
        for (Subscription subscription : subscriptions) {
            if (subscription.filter().matches(envelope)) {
                result.add(subscription);
            }
        }
        return result;
    }

    public List<Subscription> snapshot() {
        return List.copyOf(subscriptions);
    }

    public int size() {
        return subscriptions.size();
    }

    public void clear() {
        subscriptions.clear();
    }
}
