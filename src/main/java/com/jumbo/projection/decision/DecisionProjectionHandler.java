package com.jumbo.projection.decision;

import com.jumbo.bus.EventBus;
import com.jumbo.contract.EventEnvelope;
import com.jumbo.projection.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps {@code decision_views} in step with the decision event streams.
 */
public class DecisionProjectionHandler {

    private static final Logger log = LoggerFactory.getLogger(DecisionProjectionHandler.class);

    private static final List<String> TEXT_FIELDS = List.of("title", "context", "rationale", "consequences");

    private final DecisionProjectionStore store;
    private final JsonColumns json;

    public DecisionProjectionHandler(DecisionProjectionStore store, JsonColumns json) {
        this.store = store;
        this.json = json;
    }

    public void subscribe(EventBus bus) {
        bus.subscribe(DecisionEventTypes.ADDED, this::onAdded);
        bus.subscribe(DecisionEventTypes.UPDATED, this::onUpdated);
        bus.subscribe(DecisionEventTypes.REVERSED, this::onReversed);
        bus.subscribe(DecisionEventTypes.SUPERSEDED, this::onSuperseded);
    }

    void onAdded(EventEnvelope event) {
        store.insert(new DecisionView(
            event.aggregateId(),
            event.payloadText("title"),
            event.payloadText("context"),
            event.payloadText("rationale"),
            event.payloadList("alternatives").stream().map(String::valueOf).toList(),
            event.payloadText("consequences"),
            DecisionStatus.ACTIVE.getValue(),
            null,
            null,
            null,
            event.version(),
            event.timestamp(),
            event.timestamp()));
    }

    /** Fields absent from the payload keep their current value. */
    void onUpdated(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        for (String field : TEXT_FIELDS) {
            if (event.hasPayload(field)) {
                changes.put(field, event.payloadText(field));
            }
        }
        if (event.payloadValue("alternatives") != null) {
            changes.put("alternatives", json.writeList(event.payloadList("alternatives")));
        }
        stamp(changes, event);
        apply(event, changes);
    }

    void onReversed(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", DecisionStatus.REVERSED.getValue());
        changes.put("reversalReason", event.payloadText("reason"));
        String reversedAt = event.payloadText("reversedAt");
        changes.put("reversedAt", reversedAt != null ? reversedAt : event.timestamp());
        stamp(changes, event);
        apply(event, changes);
    }

    void onSuperseded(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", DecisionStatus.SUPERSEDED.getValue());
        changes.put("supersededBy", event.payloadText("supersededBy"));
        stamp(changes, event);
        apply(event, changes);
    }

    private static void stamp(Map<String, Object> changes, EventEnvelope event) {
        changes.put("version", event.version());
        changes.put("updatedAt", event.timestamp());
    }

    private void apply(EventEnvelope event, Map<String, Object> changes) {
        if (store.updateColumns(event.aggregateId(), changes) == 0) {
            log.debug("Decision {} not projected, skipping {}", event.aggregateId(), event.type());
        }
    }
}
