package com.jumbo.bus;

import com.jumbo.contract.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-then-publish: an envelope reaches the bus only after it is durably stored, and an
 * envelope rejected by the store is never published.
 */
public class EventRecorder {

    private static final Logger log = LoggerFactory.getLogger(EventRecorder.class);

    private final EventStore eventStore;
    private final EventBus eventBus;

    public EventRecorder(EventStore eventStore, EventBus eventBus) {
        this.eventStore = eventStore;
        this.eventBus = eventBus;
    }

    public AppendResult record(EventEnvelope event) {
        AppendResult result = eventStore.append(event);
        log.debug("Recorded {} v{} on {}", event.type(), event.version(), event.aggregateId());
        eventBus.publish(event);
        return result;
    }
}
