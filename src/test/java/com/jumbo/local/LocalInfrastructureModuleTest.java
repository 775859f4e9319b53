package com.jumbo.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jumbo.bus.ConcurrencyConflictException;
import com.jumbo.persistence.SqliteDatabase;
import com.jumbo.projection.goal.GoalView;
import com.jumbo.rebuild.ReplayFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.jumbo.TestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

class LocalInfrastructureModuleTest {

    @TempDir
    Path tempDir;

    private Path rootDir;
    private LocalInfrastructureModule module;

    @BeforeEach
    void setUp() {
        rootDir = tempDir.resolve("project/.jumbo");
        module = new LocalInfrastructureModule(rootDir, 4, new ObjectMapper(), new SystemEventClock());
    }

    @AfterEach
    void tearDown() {
        module.dispose();
    }

    @Test
    void createsRootDirectoryAndDatabaseInWalMode() {
        assertTrue(Files.isDirectory(rootDir));
        assertEquals(rootDir.resolve(LocalInfrastructureModule.DATABASE_FILE).toAbsolutePath(), module.getDatabaseFile());
        assertEquals("wal", module.database().journalMode().toLowerCase());
    }

    @Test
    void schemaIsMigratedOnStartup() {
        List<String> tables = module.database().getJdbcTemplate().queryForList(
            "SELECT name FROM sqlite_master WHERE type = 'table'", String.class);

        assertTrue(tables.containsAll(List.of("session_views", "goal_views", "decision_views",
            "component_views", "session_summary_views", "architecture_views", "dependency_views",
            "guideline_views", "invariant_views")));
    }

    @Test
    void reopeningAnExistingProject_keepsProjectionsAndAppliesNothingNew() {
        module.getEventRecorder().record(event("GoalAddedEvent", "goal_1", 1, 0, "objective", "Persist", "status", "to-do"));
        module.dispose();

        module = new LocalInfrastructureModule(rootDir, 2, new ObjectMapper(), new SystemEventClock());

        assertEquals("Persist", module.getProjections().goals().findById("goal_1").map(GoalView::objective).orElseThrow());
        assertEquals(1, module.getEventStore().readStream("goal_1").size());
    }

    @Test
    void recordedEvents_reachProjectionsThroughTheConcurrentBus() {
        module.getEventRecorder().record(event("SessionStartedEvent", "session_1", 1, 0, "focus", "tests"));
        module.getEventRecorder().record(event("GoalAddedEvent", "goal_1", 1, 1, "objective", "Cover bus", "status", "to-do"));
        module.getEventRecorder().record(event("GoalStartedEvent", "goal_1", 2, 2, "status", "doing"));

        assertEquals("doing", module.getProjections().goals().findById("goal_1").orElseThrow().status());
        assertEquals("active", module.getProjections().sessions().findById("session_1").orElseThrow().status());
        assertEquals(1, module.getProjections().sessionSummaries().findLatest().orElseThrow().goalsStarted().size());
    }

    @Test
    void conflictingAppend_surfacesToCaller() {
        module.getEventRecorder().record(event("GoalAddedEvent", "goal_1", 1, 0, "objective", "x", "status", "to-do"));

        assertThrows(ConcurrencyConflictException.class,
            () -> module.getEventRecorder().record(event("GoalAddedEvent", "goal_1", 1, 1, "objective", "y")));
        assertEquals("x", module.getProjections().goals().findById("goal_1").orElseThrow().objective());
    }

    @Test
    void failureAfterOpeningDatabase_releasesIt() {
        Path otherRoot = tempDir.resolve("broken/.jumbo");

        assertThrows(IllegalArgumentException.class,
            () -> new LocalInfrastructureModule(otherRoot, 0, new ObjectMapper(), new SystemEventClock()));

        Path databaseFile = otherRoot.resolve(LocalInfrastructureModule.DATABASE_FILE);
        assertTrue(Files.exists(databaseFile));
        assertFalse(Files.exists(SqliteDatabase.sidecarFiles(databaseFile).get(0)), "write-ahead log left open");
        try (SqliteDatabase reopened = SqliteDatabase.open(databaseFile)) {
            assertEquals(0, reopened.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM goal_views", Integer.class));
        }
    }

    @Test
    void failedRebuild_leavesPreviousDatabaseForTheNextModule() {
        module.getEventRecorder().record(event("GoalAddedEvent", "goal_1", 1, 0, "objective", "Keep me", "status", "to-do"));
        // component_views.name is NOT NULL, so replay fails on this envelope
        module.getEventStore().append(event("ComponentAddedEvent", "component_1", 1, 1, "status", "active"));

        assertThrows(ReplayFailureException.class, () -> module.getDatabaseRebuildService().rebuild());
        module.dispose();

        module = new LocalInfrastructureModule(rootDir, 2, new ObjectMapper(), new SystemEventClock());
        assertEquals("Keep me", module.getProjections().goals().findById("goal_1").orElseThrow().objective());
        assertFalse(Files.exists(rootDir.resolve(LocalInfrastructureModule.DATABASE_FILE + ".rebuild")));
    }

    @Test
    void dispose_runsOnce() {
        module.dispose();
        module.dispose();

        assertTrue(module.isDisposed());
        assertTrue(module.database().isClosed());
    }

    @Test
    void clockIsExposed() {
        assertDoesNotThrow(() -> java.time.Instant.parse(module.getClock().nowIso()));
    }
}
