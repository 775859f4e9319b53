package com.jumbo.projection.architecture;

import com.jumbo.bus.EventBus;
import com.jumbo.contract.EventEnvelope;
import com.jumbo.projection.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ArchitectureProjectionHandler {

    private static final Logger log = LoggerFactory.getLogger(ArchitectureProjectionHandler.class);

    private static final List<String> TEXT_FIELDS = List.of("description", "organization");
    private static final List<String> LIST_FIELDS = List.of("patterns", "principles", "dataStores", "stack");

    private final ArchitectureProjectionStore store;
    private final JsonColumns json;

    public ArchitectureProjectionHandler(ArchitectureProjectionStore store, JsonColumns json) {
        this.store = store;
        this.json = json;
    }

    public void subscribe(EventBus bus) {
        bus.subscribe(ArchitectureEventTypes.DEFINED, this::onDefined);
        bus.subscribe(ArchitectureEventTypes.UPDATED, this::onUpdated);
    }

    void onDefined(EventEnvelope event) {
        store.insert(new ArchitectureView(
            event.aggregateId(),
            event.payloadText("description"),
            event.payloadText("organization"),
            strings(event, "patterns"),
            strings(event, "principles"),
            entries(event, "dataStores"),
            strings(event, "stack"),
            event.version(),
            event.timestamp(),
            event.timestamp()));
    }

    /** Absent fields keep their value; a present list replaces the stored one. */
    void onUpdated(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        for (String field : TEXT_FIELDS) {
            if (event.hasPayload(field)) {
                changes.put(field, event.payloadText(field));
            }
        }
        for (String field : LIST_FIELDS) {
            if (event.payloadValue(field) != null) {
                changes.put(field, json.writeList(event.payloadList(field)));
            }
        }
        changes.put("version", event.version());
        changes.put("updatedAt", event.timestamp());
        if (store.updateColumns(event.aggregateId(), changes) == 0) {
            log.debug("Architecture {} not projected, skipping {}", event.aggregateId(), event.type());
        }
    }

    private static List<String> strings(EventEnvelope event, String field) {
        return event.payloadList(field).stream().map(String::valueOf).toList();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> entries(EventEnvelope event, String field) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Object item : event.payloadList(field)) {
            if (item instanceof Map<?, ?> map) {
                entries.add((Map<String, Object>) map);
            }
        }
        return entries;
    }
}
