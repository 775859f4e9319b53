package com.jumbo.projection.decision;

import com.jumbo.projection.ProjectionTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.jumbo.TestEvents.at;
import static com.jumbo.TestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

class DecisionProjectionHandlerTest extends ProjectionTestSupport {

    @BeforeEach
    void addDecision() {
        publish(event(DecisionEventTypes.ADDED, "decision_1", 1, 0,
            "title", "Use SQLite", "context", "Local only", "rationale", "Embedded",
            "alternatives", List.of("Postgres", "Files"), "consequences", "Single writer"));
    }

    private DecisionView decision() {
        return projections.decisions().findById("decision_1").orElseThrow();
    }

    @Test
    void added_startsActive() {
        DecisionView decision = decision();
        assertEquals("Use SQLite", decision.title());
        assertEquals(List.of("Postgres", "Files"), decision.alternatives());
        assertEquals("active", decision.status());
    }

    @Test
    void updated_keepsFieldsMissingFromPayload() {
        publish(event(DecisionEventTypes.UPDATED, "decision_1", 2, 1, "rationale", "Zero ops"));

        DecisionView decision = decision();
        assertEquals("Use SQLite", decision.title());
        assertEquals("Zero ops", decision.rationale());
        assertEquals(List.of("Postgres", "Files"), decision.alternatives());
        assertEquals(2, decision.version());
    }

    @Test
    void reversed_recordsReason() {
        publish(event(DecisionEventTypes.REVERSED, "decision_1", 2, 1, "reason", "Needs sharing", "reversedAt", at(1)));

        DecisionView decision = decision();
        assertEquals("reversed", decision.status());
        assertEquals("Needs sharing", decision.reversalReason());
        assertEquals(at(1), decision.reversedAt());
    }

    @Test
    void superseded_pointsAtReplacement() {
        publish(event(DecisionEventTypes.SUPERSEDED, "decision_1", 2, 1, "supersededBy", "decision_2"));

        assertEquals("superseded", decision().status());
        assertEquals("decision_2", decision().supersededBy());
        assertEquals(1, projections.decisions().findAll("superseded").size());
        assertTrue(projections.decisions().findAll("active").isEmpty());
    }
}
