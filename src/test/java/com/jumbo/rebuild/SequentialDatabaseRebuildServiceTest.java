package com.jumbo.rebuild;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jumbo.bus.ConcurrentEventBus;
import com.jumbo.bus.EventRecorder;
import com.jumbo.bus.FileSystemEventStore;
import com.jumbo.bus.SequentialReplayEventBus;
import com.jumbo.contract.EnvelopeValidator;
import com.jumbo.contract.EventEnvelope;
import com.jumbo.persistence.MigrationCatalog;
import com.jumbo.persistence.MigrationRunner;
import com.jumbo.persistence.SqliteDatabase;
import com.jumbo.projection.JsonColumns;
import com.jumbo.projection.ProjectionWiring;
import com.jumbo.projection.goal.GoalView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

import static com.jumbo.TestEvents.event;
import static org.junit.jupiter.api.Assertions.*;

class SequentialDatabaseRebuildServiceTest {

    private static final List<String> TABLES = List.of(
        "goal_views", "session_views", "decision_views", "component_views", "session_summary_views",
        "architecture_views", "dependency_views", "guideline_views", "invariant_views");

    @TempDir
    Path rootDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonColumns json = new JsonColumns(objectMapper);
    private final MigrationCatalog catalog = new MigrationCatalog();
    private ExecutorService executor;
    private FileSystemEventStore eventStore;
    private Path databaseFile;
    private SqliteDatabase live;
    private ProjectionWiring liveProjections;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        eventStore = new FileSystemEventStore(rootDir, objectMapper, new EnvelopeValidator());
        databaseFile = rootDir.resolve("jumbo.db");
        live = openMigrated(databaseFile);
    }

    @AfterEach
    void tearDown() {
        live.checkpointAndClose();
        executor.shutdownNow();
    }

    private SqliteDatabase openMigrated(Path file) {
        SqliteDatabase database = SqliteDatabase.open(file);
        new MigrationRunner(database).runNamespaceMigrations(catalog.discover());
        return database;
    }

    private SequentialDatabaseRebuildService rebuildService() {
        return new SequentialDatabaseRebuildService(databaseFile, eventStore, json, catalog, live::checkpointAndClose);
    }

    /** Records a log spanning every projection through the concurrent bus. */
    private int recordMixedHistory() {
        ConcurrentEventBus bus = new ConcurrentEventBus(executor);
        liveProjections = ProjectionWiring.wire(live.getJdbcTemplate(), json, bus);
        EventRecorder recorder = new EventRecorder(eventStore, bus);
        List<EventEnvelope> history = List.of(
            event("SessionStartedEvent", "session_1", 1, 0, "focus", "storage"),
            event("GoalAddedEvent", "goal_1", 1, 1, "objective", "Event store", "status", "to-do"),
            event("GoalAddedEvent", "goal_2", 1, 2, "objective", "Rebuild", "status", "to-do"),
            event("GoalStartedEvent", "goal_1", 2, 3, "status", "doing", "claimedBy", "w1"),
            event("DecisionAddedEvent", "decision_1", 1, 4, "title", "Files per event", "rationale", "Simple"),
            event("ComponentAddedEvent", "component_1", 1, 5, "name", "EventStore", "status", "active"),
            event("GoalProgressUpdatedEvent", "goal_1", 3, 6, "taskDescription", "append"),
            event("GoalCompletedEvent", "goal_1", 4, 7, "status", "completed"),
            event("GoalBlockedEvent", "goal_2", 2, 8, "status", "blocked", "note", "needs store"),
            event("ComponentDeprecatedEvent", "component_1", 2, 9, "reason", "renamed"),
            event("DecisionSupersededEvent", "decision_1", 2, 10, "supersededBy", "decision_2"),
            event("SessionEndedEvent", "session_1", 2, 11, "focus", "storage done"),
            event("SessionStartedEvent", "session_2", 1, 12, "focus", "rebuild"),
            event("GoalRemovedEvent", "goal_2", 3, 13),
            event("ArchitectureDefinedEvent", "architecture", 1, 14, "description", "Local engine",
                "patterns", List.of("event sourcing")),
            event("DependencyAddedEvent", "dep_1", 1, 15, "consumerId", "component_1", "providerId", "component_2"),
            event("DependencyRemovedEvent", "dep_1", 2, 16, "reason", "inlined"),
            event("GuidelineAddedEvent", "guideline_1", 1, 17, "category", "testing", "title", "Test handlers"),
            event("InvariantAddedEvent", "invariant_1", 1, 18, "title", "Append-only"),
            event("InvariantAddedEvent", "invariant_2", 1, 19, "title", "Temporary"),
            event("InvariantRemovedEvent", "invariant_2", 2, 20));
        history.forEach(recorder::record);
        return history.size();
    }

    private static Map<String, Integer> rowCounts(JdbcTemplate jdbc) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String table : TABLES) {
            counts.put(table, jdbc.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class));
        }
        return counts;
    }

    private ProjectionWiring readers(SqliteDatabase database) {
        return ProjectionWiring.wire(database.getJdbcTemplate(), json, new SequentialReplayEventBus());
    }

    private <T> T withRebuiltDatabase(Function<SqliteDatabase, T> query) {
        SqliteDatabase rebuilt = SqliteDatabase.open(databaseFile);
        try {
            return query.apply(rebuilt);
        } finally {
            rebuilt.checkpointAndClose();
        }
    }

    @Test
    void rebuiltProjections_haveTheSameRowsAsIncrementalOperation() {
        int recorded = recordMixedHistory();
        Map<String, Integer> incremental = rowCounts(live.getJdbcTemplate());
        List<GoalView> incrementalGoals = liveProjections.goals().findAll();

        DatabaseRebuildResult result = rebuildService().rebuild();

        assertTrue(result.success());
        assertEquals(recorded, result.eventsReplayed());
        assertEquals(incremental, withRebuiltDatabase(db -> rowCounts(db.getJdbcTemplate())));
        assertEquals(incrementalGoals, withRebuiltDatabase(db -> readers(db).goals().findAll()));
    }

    @Test
    void rebuild_seesFullyAppliedGoalState_inSessionSummary() {
        recordMixedHistory();

        rebuildService().rebuild();

        List<Map<String, Object>> completed = withRebuiltDatabase(db ->
            readers(db).sessionSummaries().findByOriginalId("session_1").orElseThrow().completedGoals());
        assertEquals(1, completed.size());
        assertEquals("completed", completed.get(0).get("status"));
    }

    @Test
    void eventsSharingOneTimestamp_replayInAppendOrder() {
        SequentialReplayEventBus bus = new SequentialReplayEventBus();
        liveProjections = ProjectionWiring.wire(live.getJdbcTemplate(), json, bus);
        EventRecorder recorder = new EventRecorder(eventStore, bus);
        recorder.record(event("SessionStartedEvent", "session_z", 1, 0, "focus", "ties"));
        recorder.record(event("GoalAddedEvent", "goal_a", 1, 0, "objective", "Order", "status", "to-do"));
        recorder.record(event("GoalCompletedEvent", "goal_a", 2, 0, "status", "completed"));
        int incremental = liveProjections.sessionSummaries().findLatest().orElseThrow().completedGoals().size();

        rebuildService().rebuild();

        int rebuilt = withRebuiltDatabase(db ->
            readers(db).sessionSummaries().findLatest().orElseThrow().completedGoals().size());
        assertEquals(1, incremental);
        assertEquals(incremental, rebuilt);
    }

    @Test
    void rebuildingTwice_givesTheSameResult() {
        recordMixedHistory();

        DatabaseRebuildResult first = rebuildService().rebuild();
        Map<String, Integer> afterFirst = withRebuiltDatabase(db -> rowCounts(db.getJdbcTemplate()));
        DatabaseRebuildResult second = rebuildService().rebuild();
        Map<String, Integer> afterSecond = withRebuiltDatabase(db -> rowCounts(db.getJdbcTemplate()));

        assertEquals(first, second);
        assertEquals(afterFirst, afterSecond);
    }

    @Test
    void rebuild_neverTouchesTheEventLog() {
        recordMixedHistory();
        List<EventEnvelope> before = eventStore.getAllEvents();

        rebuildService().rebuild();

        assertEquals(before, eventStore.getAllEvents());
    }

    @Test
    void emptyLog_yieldsEmptyMigratedDatabase() {
        DatabaseRebuildResult result = rebuildService().rebuild();

        assertEquals(new DatabaseRebuildResult(0, true), result);
        assertEquals(0, withRebuiltDatabase(db -> rowCounts(db.getJdbcTemplate())).values().stream()
            .mapToInt(Integer::intValue).sum());
    }

    @Test
    void failedReplay_leavesPreviousDatabaseIntact() {
        live.getJdbcTemplate().update("""
            INSERT INTO component_views (componentId, name, status, version, createdAt, updatedAt)
            VALUES ('marker', 'Marker', 'active', 1, 'x', 'x')
            """);
        eventStore.append(event("SessionStartedEvent", "session_1", 1, 0));
        // component_views.name is NOT NULL, so this envelope cannot be projected
        eventStore.append(event("ComponentAddedEvent", "component_1", 1, 1, "status", "active"));
        SequentialDatabaseRebuildService service = rebuildService();

        ReplayFailureException ex = assertThrows(ReplayFailureException.class, service::rebuild);

        assertEquals(2, ex.getPosition());
        assertEquals(RebuildPhase.REPLAYING_LOG, ex.getPhase());
        assertEquals(RebuildPhase.FAILED, service.getPhase());
        assertFalse(Files.exists(rootDir.resolve("jumbo.db" + SequentialDatabaseRebuildService.TEMP_SUFFIX)));
        assertEquals("Marker", withRebuiltDatabase(db -> db.getJdbcTemplate().queryForObject(
            "SELECT name FROM component_views WHERE componentId = 'marker'", String.class)));
    }

    @Test
    void failingToReleaseLiveConnection_isReportedAsRebuildFailure() {
        eventStore.append(event("SessionStartedEvent", "session_1", 1, 0));
        IllegalStateException closeFailure = new IllegalStateException("checkpoint failed");
        SequentialDatabaseRebuildService service = new SequentialDatabaseRebuildService(
            databaseFile, eventStore, json, catalog, () -> {
                throw closeFailure;
            });

        ReplayFailureException ex = assertThrows(ReplayFailureException.class, service::rebuild);

        assertEquals(RebuildPhase.CLOSING_OLD_CONNECTION, ex.getPhase());
        assertEquals(0, ex.getPosition());
        assertSame(closeFailure, ex.getCause());
        assertEquals(RebuildPhase.FAILED, service.getPhase());
        assertFalse(Files.exists(rootDir.resolve("jumbo.db" + SequentialDatabaseRebuildService.TEMP_SUFFIX)));
    }
}
