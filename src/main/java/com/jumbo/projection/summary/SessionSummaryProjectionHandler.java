package com.jumbo.projection.summary;

import com.jumbo.bus.EventBus;
import com.jumbo.contract.EventEnvelope;
import com.jumbo.projection.decision.DecisionEventTypes;
import com.jumbo.projection.decision.DecisionReader;
import com.jumbo.projection.decision.DecisionView;
import com.jumbo.projection.goal.GoalEventTypes;
import com.jumbo.projection.goal.GoalReader;
import com.jumbo.projection.goal.GoalView;
import com.jumbo.projection.session.SessionEventTypes;
import com.jumbo.projection.session.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Cross-aggregate projection summarizing what happened during the current session.
 *
 * <p>Goal and decision events carry little more than ids, so entries are enriched from the goal
 * and decision projections. Those rows must already reflect the event being handled, which is
 * why this handler is registered after the primary projections and needs sequential dispatch
 * during replay. Entries are recorded only while the latest session is active; an event whose
 * goal or decision has no projection row is skipped.
 */
public class SessionSummaryProjectionHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionSummaryProjectionHandler.class);

    private final SessionSummaryProjectionStore store;
    private final GoalReader goalReader;
    private final DecisionReader decisionReader;

    public SessionSummaryProjectionHandler(SessionSummaryProjectionStore store,
                                           GoalReader goalReader,
                                           DecisionReader decisionReader) {
        this.store = store;
        this.goalReader = goalReader;
        this.decisionReader = decisionReader;
    }

    public void subscribe(EventBus bus) {
        bus.subscribe(SessionEventTypes.STARTED, this::onSessionStarted);
        bus.subscribe(SessionEventTypes.ENDED, event -> onSessionStatus(event, SessionStatus.ENDED));
        bus.subscribe(SessionEventTypes.PAUSED, event -> onSessionStatus(event, SessionStatus.PAUSED));
        bus.subscribe(SessionEventTypes.RESUMED, event -> onSessionStatus(event, SessionStatus.ACTIVE));

        bus.subscribe(GoalEventTypes.COMPLETED, event -> onGoalEvent(event, SummaryList.COMPLETED_GOALS,
            goal -> entry("goalId", goal.goalId(), "objective", goal.objective(),
                "status", goal.status(), "createdAt", goal.createdAt())));
        bus.subscribe(GoalEventTypes.BLOCKED, event -> onGoalEvent(event, SummaryList.BLOCKERS_ENCOUNTERED,
            goal -> entry("goalId", goal.goalId(),
                "reason", goal.note() != null && !goal.note().isBlank() ? goal.note() : "Unknown reason")));
        bus.subscribe(GoalEventTypes.STARTED, event -> onGoalEvent(event, SummaryList.GOALS_STARTED,
            goal -> entry("goalId", goal.goalId(), "objective", goal.objective(),
                "startedAt", event.timestamp())));
        bus.subscribe(GoalEventTypes.PAUSED, event -> onGoalEvent(event, SummaryList.GOALS_PAUSED,
            goal -> entry("goalId", goal.goalId(), "objective", goal.objective(),
                "reason", event.payloadText("reason"), "note", event.payloadText("note"),
                "pausedAt", event.timestamp())));
        bus.subscribe(GoalEventTypes.RESUMED, event -> onGoalEvent(event, SummaryList.GOALS_RESUMED,
            goal -> entry("goalId", goal.goalId(), "objective", goal.objective(),
                "note", event.payloadText("note"), "resumedAt", event.timestamp())));

        bus.subscribe(DecisionEventTypes.ADDED, this::onDecisionAdded);
    }

    void onSessionStarted(EventEnvelope event) {
        store.archiveLatest();
        store.upsertLatest(new SessionSummaryView(
            SessionSummaryProjectionStore.LATEST,
            event.aggregateId(),
            event.payloadText("focus"),
            SessionStatus.ACTIVE.getValue(),
            event.payloadText("contextSnapshot"),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            event.timestamp(),
            event.timestamp()));
    }

    void onSessionStatus(EventEnvelope event, SessionStatus status) {
        if (store.updateLatestStatus(status.getValue(), event.timestamp()) == 0) {
            log.debug("No latest session summary, skipping {}", event.type());
        }
    }

    void onGoalEvent(EventEnvelope event, SummaryList list, Function<GoalView, Map<String, Object>> toEntry) {
        if (!latestIsActive(event)) {
            return;
        }
        Optional<GoalView> goal = goalReader.findById(event.aggregateId());
        if (goal.isEmpty()) {
            log.debug("Goal {} not projected, skipping {} for session summary", event.aggregateId(), event.type());
            return;
        }
        store.appendToLatest(list, toEntry.apply(goal.get()), event.timestamp());
    }

    void onDecisionAdded(EventEnvelope event) {
        if (!latestIsActive(event)) {
            return;
        }
        Optional<DecisionView> decision = decisionReader.findById(event.aggregateId());
        if (decision.isEmpty()) {
            log.debug("Decision {} not projected, skipping {} for session summary", event.aggregateId(), event.type());
            return;
        }
        String rationale = decision.get().rationale();
        store.appendToLatest(SummaryList.DECISIONS,
            entry("decisionId", event.aggregateId(), "title", decision.get().title(),
                "rationale", rationale != null ? rationale : ""),
            event.timestamp());
    }

    private boolean latestIsActive(EventEnvelope event) {
        boolean active = store.findLatest().map(SessionSummaryView::isActive).orElse(false);
        if (!active) {
            log.debug("No active session, {} not recorded in session summary", event.type());
        }
        return active;
    }

    private static Map<String, Object> entry(Object... keysAndValues) {
        Map<String, Object> entry = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entry.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return entry;
    }
}
