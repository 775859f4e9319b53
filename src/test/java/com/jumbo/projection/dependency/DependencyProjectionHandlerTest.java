package com.jumbo.projection.dependency;

import com.jumbo.projection.ProjectionTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.jumbo.TestEvents.at;
import static com.jumbo.TestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

class DependencyProjectionHandlerTest extends ProjectionTestSupport {

    @BeforeEach
    void addDependency() {
        publish(event(DependencyEventTypes.ADDED, "dep_1", 1, 0,
            "consumerId", "component_api", "providerId", "component_store",
            "endpoint", "/events", "contract", "EventStore#append"));
    }

    private DependencyView dependency() {
        return projections.dependencies().findById("dep_1").orElseThrow();
    }

    @Test
    void added_isActive() {
        DependencyView dependency = dependency();
        assertEquals("active", dependency.status());
        assertEquals("component_api", dependency.consumerId());
        assertEquals(1, projections.dependencies().findByProviderId("component_store").size());
        assertEquals(1, projections.dependencies().findByConsumerId("component_api").size());
    }

    @Test
    void updated_isPartial() {
        publish(event(DependencyEventTypes.UPDATED, "dep_1", 2, 1, "endpoint", "/v2/events"));

        DependencyView dependency = dependency();
        assertEquals("/v2/events", dependency.endpoint());
        assertEquals("EventStore#append", dependency.contract());
        assertEquals(2, dependency.version());
        assertEquals(at(1), dependency.updatedAt());
    }

    @Test
    void removed_isSoftAndRecordsReason() {
        publish(event(DependencyEventTypes.REMOVED, "dep_1", 2, 5, "reason", "Inlined"));

        DependencyView dependency = dependency();
        assertEquals("removed", dependency.status());
        assertEquals(at(5), dependency.removedAt());
        assertEquals("Inlined", dependency.removalReason());
        assertEquals(1, rows("dependency_views"));
        assertTrue(projections.dependencies().findAll("active").isEmpty());
        assertEquals(1, projections.dependencies().findAll(null).size());
    }

    @Test
    void updateForUnknownDependency_isIgnored() {
        publish(event(DependencyEventTypes.UPDATED, "dep_missing", 2, 1, "endpoint", "/x"));

        assertTrue(projections.dependencies().findById("dep_missing").isEmpty());
        assertEquals(1, rows("dependency_views"));
    }
}
