package com.jumbo.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jumbo.bus.ConcurrentEventBus;
import com.jumbo.bus.EventBus;
import com.jumbo.bus.EventRecorder;
import com.jumbo.bus.EventStore;
import com.jumbo.bus.FileSystemEventStore;
import com.jumbo.contract.EnvelopeValidator;
import com.jumbo.persistence.MigrationCatalog;
import com.jumbo.persistence.MigrationRunner;
import com.jumbo.persistence.SqliteDatabase;
import com.jumbo.projection.JsonColumns;
import com.jumbo.projection.ProjectionWiring;
import com.jumbo.rebuild.DatabaseRebuildService;
import com.jumbo.rebuild.SequentialDatabaseRebuildService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the local infrastructure of one project directory: the projection database, the event
 * store, the event bus and the clock.
 *
 * <p>Construction opens {@code jumbo.db} and brings its schema up to date. The database is released
 * by a JVM shutdown hook registered here, which covers normal exit as well as SIGINT and SIGTERM,
 * and releases it at most once. Collaborators only get the narrow interfaces below, none of which
 * can close anything.
 *
 * <p>A rebuild closes this module's connection for good, whether it succeeds or fails. A failed
 * rebuild leaves {@code jumbo.db} as it was on disk, but {@link #getProjections()} queries on this
 * instance fail from then on. After {@link DatabaseRebuildService#rebuild()} the process is
 * expected to exit; a new module sees the rebuilt database, or the previous one after a failure.
 *
 * <p>If construction fails after the database was opened, the connection is checkpointed and
 * closed before the exception propagates.
 */
public class LocalInfrastructureModule {

    private static final Logger log = LoggerFactory.getLogger(LocalInfrastructureModule.class);

    public static final String DATABASE_FILE = "jumbo.db";

    private final Path rootDir;
    private final SqliteDatabase database;
    private final FileSystemEventStore eventStore;
    private final ExecutorService dispatchExecutor;
    private final ConcurrentEventBus eventBus;
    private final EventRecorder eventRecorder;
    private final EventClock clock;
    private final ProjectionWiring projections;
    private final SequentialDatabaseRebuildService rebuildService;
    private final AtomicBoolean disposed = new AtomicBoolean();
    private final Thread shutdownHook;

    public LocalInfrastructureModule(Path rootDir, int dispatchThreads, ObjectMapper objectMapper, EventClock clock) {
        this.rootDir = rootDir;
        this.clock = clock;
        try {
            Files.createDirectories(rootDir);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create project directory " + rootDir, ex);
        }

        JsonColumns json = new JsonColumns(objectMapper);
        MigrationCatalog migrationCatalog = new MigrationCatalog();
        this.database = SqliteDatabase.open(rootDir.resolve(DATABASE_FILE));
        ExecutorService executor = null;
        try {
            new MigrationRunner(database).runNamespaceMigrations(migrationCatalog.discover());

            this.eventStore = new FileSystemEventStore(rootDir, objectMapper, new EnvelopeValidator());
            CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("jumbo-dispatch-");
            threadFactory.setDaemon(true);
            executor = Executors.newFixedThreadPool(dispatchThreads, threadFactory);
            this.dispatchExecutor = executor;
            this.eventBus = new ConcurrentEventBus(dispatchExecutor);
            this.eventRecorder = new EventRecorder(eventStore, eventBus);
            this.projections = ProjectionWiring.wire(database.getJdbcTemplate(), json, eventBus);
            this.rebuildService = new SequentialDatabaseRebuildService(
                database.getPath(), eventStore, json, migrationCatalog, database::checkpointAndClose);

            this.shutdownHook = new Thread(this::dispose, "jumbo-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        } catch (RuntimeException ex) {
            if (executor != null) {
                executor.shutdownNow();
            }
            try {
                database.checkpointAndClose();
            } catch (RuntimeException closeFailure) {
                ex.addSuppressed(closeFailure);
            }
            throw ex;
        }
        log.info("Local infrastructure ready at {}", rootDir.toAbsolutePath());
    }

    public Path getRootDir() {
        return rootDir;
    }

    public Path getDatabaseFile() {
        return database.getPath();
    }

    public EventStore getEventStore() {
        return eventStore;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public EventRecorder getEventRecorder() {
        return eventRecorder;
    }

    public EventClock getClock() {
        return clock;
    }

    public ProjectionWiring getProjections() {
        return projections;
    }

    public DatabaseRebuildService getDatabaseRebuildService() {
        return rebuildService;
    }

    SqliteDatabase database() {
        return database;
    }

    boolean isDisposed() {
        return disposed.get();
    }

    /**
     * Stops dispatch and checkpoints and closes the database. Runs once; later calls return
     * immediately.
     */
    void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        if (Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ex) {
                log.debug("JVM already shutting down, hook stays registered");
            }
        }

        dispatchExecutor.shutdown();
        try {
            if (!dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event dispatch did not finish within 5s, closing database anyway");
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }

        try {
            database.checkpointAndClose();
            log.debug("Released database {}", database.getPath());
        } catch (RuntimeException ex) {
            log.warn("Failed to checkpoint database {}: {}", database.getPath(), ex.getMessage());
        }
    }
}
