package com.jumbo.rebuild;

import com.jumbo.bus.EventStore;
import com.jumbo.bus.SequentialReplayEventBus;
import com.jumbo.contract.EventEnvelope;
import com.jumbo.persistence.MigrationCatalog;
import com.jumbo.persistence.MigrationRunner;
import com.jumbo.persistence.SqliteDatabase;
import com.jumbo.projection.JsonColumns;
import com.jumbo.projection.ProjectionWiring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Rebuilds the projection database by replaying the whole event log through a freshly wired
 * {@link SequentialReplayEventBus}.
 *
 * <p>The new database is built next to the live one under a temporary name and only moved over
 * it once every envelope has been applied. A failed rebuild removes the temporary file and leaves
 * the previous database untouched. The event log is only ever read.
 */
public class SequentialDatabaseRebuildService implements DatabaseRebuildService {

    private static final Logger log = LoggerFactory.getLogger(SequentialDatabaseRebuildService.class);

    static final String TEMP_SUFFIX = ".rebuild";

    private final Path databaseFile;
    private final EventStore eventStore;
    private final JsonColumns json;
    private final MigrationCatalog migrationCatalog;
    private final Runnable releaseLiveDatabase;

    private volatile RebuildPhase phase = RebuildPhase.IDLE;

    /**
     * @param releaseLiveDatabase checkpoints and closes the connection currently open on
     *                            {@code databaseFile}; must be idempotent
     */
    public SequentialDatabaseRebuildService(Path databaseFile,
                                            EventStore eventStore,
                                            JsonColumns json,
                                            MigrationCatalog migrationCatalog,
                                            Runnable releaseLiveDatabase) {
        this.databaseFile = databaseFile;
        this.eventStore = eventStore;
        this.json = json;
        this.migrationCatalog = migrationCatalog;
        this.releaseLiveDatabase = releaseLiveDatabase;
    }

    public RebuildPhase getPhase() {
        return phase;
    }

    @Override
    public synchronized DatabaseRebuildResult rebuild() {
        Path tempFile = databaseFile.resolveSibling(databaseFile.getFileName() + TEMP_SUFFIX);

        enter(RebuildPhase.CLOSING_OLD_CONNECTION);
        try {
            releaseLiveDatabase.run();
        } catch (RuntimeException ex) {
            phase = RebuildPhase.FAILED;
            log.error("Rebuild failed during {}: {}", RebuildPhase.CLOSING_OLD_CONNECTION, ex.getMessage());
            throw new ReplayFailureException(RebuildPhase.CLOSING_OLD_CONNECTION, ex);
        }

        enter(RebuildPhase.CREATING_FRESH_DATABASE);
        SqliteDatabase fresh;
        try {
            deleteWithSidecars(tempFile);
            fresh = SqliteDatabase.open(tempFile);
        } catch (RuntimeException ex) {
            phase = RebuildPhase.FAILED;
            log.error("Rebuild failed during {}: {}", RebuildPhase.CREATING_FRESH_DATABASE, ex.getMessage());
            throw new ReplayFailureException(RebuildPhase.CREATING_FRESH_DATABASE, ex);
        }
        try {
            int replayed = replayInto(fresh);
            fresh.checkpointAndClose();

            enter(RebuildPhase.DELETING_DATABASE_FILES);
            swapIn(tempFile);

            enter(RebuildPhase.DONE);
            log.info("Rebuilt projections from {} event(s)", replayed);
            return new DatabaseRebuildResult(replayed, true);
        } catch (RuntimeException ex) {
            RebuildPhase failedIn = phase;
            phase = RebuildPhase.FAILED;
            log.error("Rebuild failed during {}: {}", failedIn, ex.getMessage());
            discard(fresh, tempFile, ex);
            if (ex instanceof ReplayFailureException) {
                throw ex;
            }
            throw new ReplayFailureException(failedIn, ex);
        }
    }

    private int replayInto(SqliteDatabase fresh) {
        enter(RebuildPhase.RUNNING_MIGRATIONS);
        new MigrationRunner(fresh).runNamespaceMigrations(migrationCatalog.discover());

        enter(RebuildPhase.WIRING_SEQUENTIAL_BUS);
        SequentialReplayEventBus bus = new SequentialReplayEventBus();
        ProjectionWiring.wire(fresh.getJdbcTemplate(), json, bus);

        enter(RebuildPhase.REPLAYING_LOG);
        List<EventEnvelope> events = eventStore.getAllEvents();
        int position = 0;
        for (EventEnvelope event : events) {
            position++;
            try {
                bus.publish(event);
            } catch (RuntimeException ex) {
                throw new ReplayFailureException(position, event, ex);
            }
        }
        return position;
    }

    /**
     * Old sidecars go first: a stale {@code -wal} next to the new main file would be replayed
     * into it on the next open.
     */
    private void swapIn(Path tempFile) {
        try {
            for (Path sidecar : SqliteDatabase.sidecarFiles(databaseFile)) {
                Files.deleteIfExists(sidecar);
            }
            for (Path sidecar : SqliteDatabase.sidecarFiles(tempFile)) {
                Files.deleteIfExists(sidecar);
            }
            try {
                Files.move(tempFile, databaseFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tempFile, databaseFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to move rebuilt database into " + databaseFile, ex);
        }
    }

    private void discard(SqliteDatabase fresh, Path tempFile, RuntimeException failure) {
        try {
            fresh.checkpointAndClose();
        } catch (RuntimeException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
        try {
            deleteWithSidecars(tempFile);
        } catch (UncheckedIOException deleteFailure) {
            failure.addSuppressed(deleteFailure);
        }
    }

    private static void deleteWithSidecars(Path file) {
        try {
            Files.deleteIfExists(file);
            for (Path sidecar : SqliteDatabase.sidecarFiles(file)) {
                Files.deleteIfExists(sidecar);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to delete " + file, ex);
        }
    }

    private void enter(RebuildPhase next) {
        log.debug("Rebuild phase {} -> {}", phase, next);
        phase = next;
    }
}
