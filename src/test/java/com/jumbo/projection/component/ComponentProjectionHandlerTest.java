package com.jumbo.projection.component;

import com.jumbo.projection.ProjectionTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.jumbo.TestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

class ComponentProjectionHandlerTest extends ProjectionTestSupport {

    @BeforeEach
    void addComponent() {
        publish(event(ComponentEventTypes.ADDED, "component_1", 1, 0,
            "name", "EventStore", "type", "service", "description", "Append-only log",
            "responsibility", "Persist events", "path", "src/bus", "status", "active"));
    }

    private ComponentView component() {
        return projections.components().findById("component_1").orElseThrow();
    }

    @Test
    void updated_isPartial() {
        publish(event(ComponentEventTypes.UPDATED, "component_1", 2, 1, "path", "src/main/bus"));

        ComponentView component = component();
        assertEquals("src/main/bus", component.path());
        assertEquals("Append-only log", component.description());
        assertEquals(2, component.version());
    }

    @Test
    void deprecated_recordsReason() {
        publish(event(ComponentEventTypes.DEPRECATED, "component_1", 2, 1, "status", "deprecated", "reason", "Replaced"));

        assertEquals("deprecated", component().status());
        assertEquals("Replaced", component().deprecationReason());
    }

    @Test
    void removed_isSoft() {
        publish(event(ComponentEventTypes.REMOVED, "component_1", 2, 1));

        assertEquals("removed", component().status());
        assertEquals(1, rows("component_views"));
        assertTrue(projections.components().findAll("active").isEmpty());
    }
}
