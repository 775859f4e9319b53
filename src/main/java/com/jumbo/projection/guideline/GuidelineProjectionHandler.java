package com.jumbo.projection.guideline;

import com.jumbo.bus.EventBus;
import com.jumbo.contract.EventEnvelope;
import com.jumbo.projection.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class GuidelineProjectionHandler {

    private static final Logger log = LoggerFactory.getLogger(GuidelineProjectionHandler.class);

    private static final List<String> TEXT_FIELDS = List.of("category", "title", "description", "rationale", "enforcement");

    private final GuidelineProjectionStore store;
    private final JsonColumns json;

    public GuidelineProjectionHandler(GuidelineProjectionStore store, JsonColumns json) {
        this.store = store;
        this.json = json;
    }

    public void subscribe(EventBus bus) {
        bus.subscribe(GuidelineEventTypes.ADDED, this::onAdded);
        bus.subscribe(GuidelineEventTypes.UPDATED, this::onUpdated);
        bus.subscribe(GuidelineEventTypes.REMOVED, this::onRemoved);
    }

    void onAdded(EventEnvelope event) {
        store.insert(new GuidelineView(
            event.aggregateId(),
            event.payloadText("category"),
            event.payloadText("title"),
            event.payloadText("description"),
            event.payloadText("rationale"),
            event.payloadText("enforcement"),
            event.payloadList("examples").stream().map(String::valueOf).toList(),
            false,
            null,
            null,
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
        if (event.payloadValue("examples") != null) {
            changes.put("examples", json.writeList(event.payloadList("examples")));
        }
        stamp(changes, event);
        apply(event, changes);
    }

    void onRemoved(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("isRemoved", 1);
        String removedAt = event.payloadText("removedAt");
        changes.put("removedAt", removedAt != null ? removedAt : event.timestamp());
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
            log.debug("Guideline {} not projected, skipping {}", event.aggregateId(), event.type());
        }
    }
}
