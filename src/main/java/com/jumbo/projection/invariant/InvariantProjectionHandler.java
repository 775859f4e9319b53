package com.jumbo.projection.invariant;

import com.jumbo.bus.EventBus;
import com.jumbo.contract.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InvariantProjectionHandler {

    private static final Logger log = LoggerFactory.getLogger(InvariantProjectionHandler.class);

    private static final List<String> TEXT_FIELDS = List.of("title", "description", "rationale", "enforcement");

    private final InvariantProjectionStore store;

    public InvariantProjectionHandler(InvariantProjectionStore store) {
        this.store = store;
    }

    public void subscribe(EventBus bus) {
        bus.subscribe(InvariantEventTypes.ADDED, this::onAdded);
        bus.subscribe(InvariantEventTypes.UPDATED, this::onUpdated);
        bus.subscribe(InvariantEventTypes.REMOVED, this::onRemoved);
    }

    void onAdded(EventEnvelope event) {
        store.insert(new InvariantView(
            event.aggregateId(),
            event.payloadText("title"),
            event.payloadText("description"),
            event.payloadText("rationale"),
            event.payloadText("enforcement"),
            event.version(),
            event.timestamp(),
            event.timestamp()));
    }

    void onUpdated(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        for (String field : TEXT_FIELDS) {
            if (event.hasPayload(field)) {
                changes.put(field, event.payloadText(field));
            }
        }
        changes.put("version", event.version());
        changes.put("updatedAt", event.timestamp());
        if (store.updateColumns(event.aggregateId(), changes) == 0) {
            log.debug("Invariant {} not projected, skipping {}", event.aggregateId(), event.type());
        }
    }

    /** Invariants are deleted outright, not soft-removed. */
    void onRemoved(EventEnvelope event) {
        if (store.delete(event.aggregateId()) == 0) {
            log.debug("Invariant {} not projected, skipping {}", event.aggregateId(), event.type());
        }
    }
}
