package com.jumbo.contract;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable record of one domain event as it travels through the store and the bus.
 *
 * <p>{@code version} is the 1-based position of the event within its aggregate's stream.
 * Storage bookkeeping written next to the envelope (such as {@code seq}) is ignored on read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EventEnvelope(
    String type,
    String aggregateId,
    long version,
    String timestamp,
    Map<String, Object> payload
) {

    public EventEnvelope {
        // payload values may legitimately be null, so Map.copyOf is not an option
        payload = payload == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static EventEnvelope of(String type, String aggregateId, long version, String timestamp,
                                   Map<String, Object> payload) {
        return new EventEnvelope(type, aggregateId, version, timestamp, payload);
    }

    public boolean hasPayload(String key) {
        return payload.containsKey(key);
    }

    /** Payload value as text, or {@code null} when absent or null. */
    public String payloadText(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    public List<?> payloadList(String key) {
        Object value = payload.get(key);
        return value instanceof List<?> list ? list : List.of();
    }

    public Object payloadValue(String key) {
        return payload.get(key);
    }

    public EventEnvelope withType(String newType) {
        return new EventEnvelope(newType, aggregateId, version, timestamp, payload);
    }
}
