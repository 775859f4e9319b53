package com.jumbo.projection.session;

import com.jumbo.bus.EventBus;
import com.jumbo.contract.EventEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps {@code session_views} in step with the session event streams.
 */
public class SessionProjectionHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionProjectionHandler.class);

    private final SessionProjectionStore store;

    public SessionProjectionHandler(SessionProjectionStore store) {
        this.store = store;
    }

    public void subscribe(EventBus bus) {
        bus.subscribe(SessionEventTypes.STARTED, this::onStarted);
        bus.subscribe(SessionEventTypes.PAUSED, event -> onStatusChanged(event, SessionStatus.PAUSED));
        bus.subscribe(SessionEventTypes.RESUMED, event -> onStatusChanged(event, SessionStatus.ACTIVE));
        bus.subscribe(SessionEventTypes.ENDED, this::onEnded);
    }

    void onStarted(EventEnvelope event) {
        store.insert(new SessionView(
            event.aggregateId(),
            event.payloadText("focus"),
            SessionStatus.ACTIVE.getValue(),
            event.payloadText("contextSnapshot"),
            event.version(),
            event.timestamp(),
            null,
            event.timestamp(),
            event.timestamp()));
    }

    void onStatusChanged(EventEnvelope event, SessionStatus status) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", status.getValue());
        changes.put("version", event.version());
        changes.put("updatedAt", event.timestamp());
        apply(event, changes);
    }

    void onEnded(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        if (event.hasPayload("focus")) {
            changes.put("focus", event.payloadText("focus"));
        }
        changes.put("status", SessionStatus.ENDED.getValue());
        changes.put("endedAt", event.timestamp());
        changes.put("version", event.version());
        changes.put("updatedAt", event.timestamp());
        apply(event, changes);
    }

    private void apply(EventEnvelope event, Map<String, Object> changes) {
        if (store.updateColumns(event.aggregateId(), changes) == 0) {
            log.debug("Session {} not projected, skipping {}", event.aggregateId(), event.type());
        }
    }
}
