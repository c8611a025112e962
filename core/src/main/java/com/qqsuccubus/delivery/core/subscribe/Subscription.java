package com.qqsuccubus.delivery.core.subscribe;

public record Subscription(String id, EventHandler handler, EventFilter filter) {
}
