package com.jumbo.bus;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Subscriptions of one bus instance, keyed by event type, in registration order.
 */
public class HandlerRegistry {

    private final Map<String, List<EventHandler>> handlers = new ConcurrentHashMap<>();

    public void register(String eventType, EventHandler handler) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler is required");
        }
        handlers.computeIfAbsent(eventType, type -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public List<EventHandler> handlersFor(String eventType) {
        List<EventHandler> registered = handlers.get(eventType);
        return registered == null ? List.of() : List.copyOf(registered);
    }

    public Set<String> subscribedTypes() {
        return Set.copyOf(handlers.keySet());
    }

    public int handlerCount() {
        return handlers.values().stream().mapToInt(List::size).sum();
    }
}
