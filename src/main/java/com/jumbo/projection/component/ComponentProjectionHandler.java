package com.jumbo.projection.component;

import com.jumbo.bus.EventBus;
import com.jumbo.contract.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ComponentProjectionHandler {

    private static final Logger log = LoggerFactory.getLogger(ComponentProjectionHandler.class);

    private static final List<String> UPDATABLE_FIELDS = List.of("description", "responsibility", "path", "type");

    private final ComponentProjectionStore store;

    public ComponentProjectionHandler(ComponentProjectionStore store) {
        this.store = store;
    }

    public void subscribe(EventBus bus) {
        bus.subscribe(ComponentEventTypes.ADDED, this::onAdded);
        bus.subscribe(ComponentEventTypes.UPDATED, this::onUpdated);
        bus.subscribe(ComponentEventTypes.DEPRECATED, this::onDeprecated);
        bus.subscribe(ComponentEventTypes.REMOVED, this::onRemoved);
    }

    void onAdded(EventEnvelope event) {
        String status = event.payloadText("status");
        store.insert(new ComponentView(
            event.aggregateId(),
            event.payloadText("name"),
            event.payloadText("type"),
            event.payloadText("description"),
            event.payloadText("responsibility"),
            event.payloadText("path"),
            status != null ? status : ComponentStatus.ACTIVE.getValue(),
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

    void onDeprecated(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", statusOr(event, ComponentStatus.DEPRECATED));
        changes.put("deprecationReason", event.payloadText("reason"));
        stamp(changes, event);
        apply(event, changes);
    }

    /** Removal is soft: the row stays with status {@code removed}. */
    void onRemoved(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", statusOr(event, ComponentStatus.REMOVED));
        stamp(changes, event);
        apply(event, changes);
    }

    private static String statusOr(EventEnvelope event, ComponentStatus fallback) {
        String status = event.payloadText("status");
        return status != null ? status : fallback.getValue();
    }

    private static void stamp(Map<String, Object> changes, EventEnvelope event) {
        changes.put("version", event.version());
        changes.put("updatedAt", event.timestamp());
    }

    private void apply(EventEnvelope event, Map<String, Object> changes) {
        if (store.updateColumns(event.aggregateId(), changes) == 0) {
            log.debug("Component {} not projected, skipping {}", event.aggregateId(), event.type());
        }
    }
}
