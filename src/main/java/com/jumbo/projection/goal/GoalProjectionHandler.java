package com.jumbo.projection.goal;

import com.jumbo.bus.EventBus;
import com.jumbo.contract.EventEnvelope;
import com.jumbo.projection.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps {@code goal_views} in step with the goal event streams.
 */
public class GoalProjectionHandler {

    private static final Logger log = LoggerFactory.getLogger(GoalProjectionHandler.class);

    static final List<String> EMBEDDED_CONTEXT_FIELDS = List.of(
        "relevantInvariants", "relevantGuidelines", "relevantDependencies", "relevantComponents",
        "architecture", "filesToBeCreated", "filesToBeChanged");

    private static final List<String> DEFINITION_LIST_FIELDS = List.of(
        "successCriteria", "scopeIn", "scopeOut", "boundaries");

    private final GoalProjectionStore store;
    private final JsonColumns json;

    public GoalProjectionHandler(GoalProjectionStore store, JsonColumns json) {
        this.store = store;
        this.json = json;
    }

    public void subscribe(EventBus bus) {
        bus.subscribe(GoalEventTypes.ADDED, this::onAdded);
        bus.subscribe(GoalEventTypes.STARTED, this::onStarted);
        bus.subscribe(GoalEventTypes.UPDATED, this::onUpdated);
        bus.subscribe(GoalEventTypes.BLOCKED, event -> onStatusWithNote(event, GoalStatus.BLOCKED));
        bus.subscribe(GoalEventTypes.UNBLOCKED, this::onUnblocked);
        bus.subscribe(GoalEventTypes.PAUSED, event -> onStatusWithNote(event, GoalStatus.PAUSED));
        bus.subscribe(GoalEventTypes.RESUMED, this::onResumed);
        bus.subscribe(GoalEventTypes.COMPLETED, event -> onReleased(event, GoalStatus.COMPLETED));
        bus.subscribe(GoalEventTypes.SUBMITTED_FOR_REVIEW, event -> onReleased(event, GoalStatus.IN_REVIEW));
        bus.subscribe(GoalEventTypes.RESET, this::onReset);
        bus.subscribe(GoalEventTypes.PROGRESS_UPDATED, this::onProgressUpdated);
        bus.subscribe(GoalEventTypes.REMOVED, this::onRemoved);
    }

    void onAdded(EventEnvelope event) {
        store.insert(new GoalView(
            event.aggregateId(),
            event.payloadText("objective"),
            strings(event.payloadList("successCriteria")),
            strings(event.payloadList("scopeIn")),
            strings(event.payloadList("scopeOut")),
            strings(event.payloadList("boundaries")),
            statusOr(event, GoalStatus.TO_DO),
            null,
            null,
            null,
            null,
            embeddedContext(event, null),
            List.of(),
            event.payloadText("nextGoalId"),
            event.version(),
            event.timestamp(),
            event.timestamp()));
    }

    void onStarted(EventEnvelope event) {
        Map<String, Object> changes = stamped(event);
        changes.put("status", statusOr(event, GoalStatus.DOING));
        putClaim(changes, event);
        apply(event, changes);
    }

    void onUpdated(EventEnvelope event) {
        Map<String, Object> changes = stamped(event);
        if (event.hasPayload("objective")) {
            changes.put("objective", event.payloadText("objective"));
        }
        for (String field : DEFINITION_LIST_FIELDS) {
            if (event.hasPayload(field)) {
                changes.put(field, json.writeList(event.payloadList(field)));
            }
        }
        if (event.hasPayload("nextGoalId")) {
            changes.put("nextGoalId", event.payloadText("nextGoalId"));
        }
        if (EMBEDDED_CONTEXT_FIELDS.stream().anyMatch(event::hasPayload)) {
            Map<String, Object> current = store.findById(event.aggregateId())
                .map(GoalView::embeddedContext)
                .orElse(null);
            changes.put("embeddedContext", json.write(embeddedContext(event, current)));
        }
        apply(event, changes);
    }

    /** Blocked and paused: the payload note replaces the current one. */
    void onStatusWithNote(EventEnvelope event, GoalStatus fallback) {
        Map<String, Object> changes = stamped(event);
        changes.put("status", statusOr(event, fallback));
        changes.put("note", event.payloadText("note"));
        apply(event, changes);
    }

    void onUnblocked(EventEnvelope event) {
        Map<String, Object> changes = stamped(event);
        changes.put("status", statusOr(event, GoalStatus.DOING));
        changes.put("note", event.payloadText("note"));
        apply(event, changes);
    }

    void onResumed(EventEnvelope event) {
        Map<String, Object> changes = stamped(event);
        changes.put("status", statusOr(event, GoalStatus.DOING));
        changes.put("note", event.payloadText("note"));
        putClaim(changes, event);
        apply(event, changes);
    }

    /** Completed and submitted for review: the worker's claim ends. */
    void onReleased(EventEnvelope event, GoalStatus fallback) {
        Map<String, Object> changes = stamped(event);
        changes.put("status", statusOr(event, fallback));
        clearClaim(changes);
        apply(event, changes);
    }

    void onReset(EventEnvelope event) {
        Map<String, Object> changes = stamped(event);
        changes.put("status", statusOr(event, GoalStatus.TO_DO));
        changes.put("note", null);
        clearClaim(changes);
        apply(event, changes);
    }

    void onProgressUpdated(EventEnvelope event) {
        GoalView current = store.findById(event.aggregateId()).orElse(null);
        if (current == null) {
            log.debug("Goal {} not projected, skipping {}", event.aggregateId(), event.type());
            return;
        }
        List<String> progress = new ArrayList<>(current.progress());
        progress.add(event.payloadText("taskDescription"));
        Map<String, Object> changes = stamped(event);
        changes.put("progress", json.writeList(progress));
        apply(event, changes);
    }

    void onRemoved(EventEnvelope event) {
        store.delete(event.aggregateId());
    }

    private void apply(EventEnvelope event, Map<String, Object> changes) {
        if (store.updateColumns(event.aggregateId(), changes) == 0) {
            log.debug("Goal {} not projected, skipping {}", event.aggregateId(), event.type());
        }
    }

    private static Map<String, Object> stamped(EventEnvelope event) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("version", event.version());
        changes.put("updatedAt", event.timestamp());
        return changes;
    }

    private static void putClaim(Map<String, Object> changes, EventEnvelope event) {
        changes.put("claimedBy", event.payloadText("claimedBy"));
        changes.put("claimedAt", event.payloadText("claimedAt"));
        changes.put("claimExpiresAt", event.payloadText("claimExpiresAt"));
    }

    private static void clearClaim(Map<String, Object> changes) {
        changes.put("claimedBy", null);
        changes.put("claimedAt", null);
        changes.put("claimExpiresAt", null);
    }

    private static String statusOr(EventEnvelope event, GoalStatus fallback) {
        String status = event.payloadText("status");
        return status != null ? status : fallback.getValue();
    }

    private static Map<String, Object> embeddedContext(EventEnvelope event, Map<String, Object> current) {
        Map<String, Object> context = current == null ? new LinkedHashMap<>() : new LinkedHashMap<>(current);
        for (String field : EMBEDDED_CONTEXT_FIELDS) {
            if (event.hasPayload(field)) {
                context.put(field, event.payloadValue(field));
            }
        }
        return context.isEmpty() ? null : context;
    }

    private static List<String> strings(List<?> values) {
        return values.stream().map(value -> value == null ? null : value.toString()).toList();
    }
}
