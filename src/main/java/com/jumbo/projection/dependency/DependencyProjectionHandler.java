package com.jumbo.projection.dependency;

import com.jumbo.bus.EventBus;
import com.jumbo.contract.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DependencyProjectionHandler {

    private static final Logger log = LoggerFactory.getLogger(DependencyProjectionHandler.class);

    private static final List<String> UPDATABLE_FIELDS = List.of("endpoint", "contract", "status");

    private final DependencyProjectionStore store;

    public DependencyProjectionHandler(DependencyProjectionStore store) {
        this.store = store;
    }

    public void subscribe(EventBus bus) {
        bus.subscribe(DependencyEventTypes.ADDED, this::onAdded);
        bus.subscribe(DependencyEventTypes.UPDATED, this::onUpdated);
        bus.subscribe(DependencyEventTypes.REMOVED, this::onRemoved);
    }

    void onAdded(EventEnvelope event) {
        store.insert(new DependencyView(
            event.aggregateId(),
            event.payloadText("consumerId"),
            event.payloadText("providerId"),
            event.payloadText("endpoint"),
            event.payloadText("contract"),
            DependencyStatus.ACTIVE.getValue(),
            null,
            null,
            event.version(),
            event.timestamp(),
            event.timestamp()));
    }

    void onUpdated(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        for (String field : UPDATABLE_FIELDS) {
            if (event.hasPayload(field)) {
                changes.put(field, event.payloadText(field));
            }
        }
        stamp(changes, event);
        apply(event, changes);
    }

    /** Soft removal, the row is kept for the dependency history. */
    void onRemoved(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", DependencyStatus.REMOVED.getValue());
        changes.put("removedAt", event.timestamp());
        changes.put("removalReason", event.payloadText("reason"));
        stamp(changes, event);
        apply(event, changes);
    }

    private static void stamp(Map<String, Object> changes, EventEnvelope event) {
        changes.put("version", event.version());
        changes.put("updatedAt", event.timestamp());
    }

    private void apply(EventEnvelope event, Map<String, Object> changes) {
        if (store.updateColumns(event.aggregateId(), changes) == 0) {
            log.debug("Dependency {} not projected, skipping {}", event.aggregateId(), event.type());
        }
    }
}
