package com.jumbo.bus;

import com.jumbo.contract.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public abstract class AbstractEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(AbstractEventBus.class);

    private final HandlerRegistry registry;

    protected AbstractEventBus(HandlerRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void subscribe(String eventType, EventHandler handler) {
        registry.register(eventType, handler);
    }

    @Override
    public void publish(EventEnvelope event) {
        List<EventHandler> handlers = registry.handlersFor(event.type());
        if (handlers.isEmpty()) {
            log.debug("No handlers subscribed to {}", event.type());
            return;
        }
        dispatch(event, handlers);
    }

    public HandlerRegistry getRegistry() {
        return registry;
    }

    protected abstract void dispatch(EventEnvelope event, List<EventHandler> handlers);
}
