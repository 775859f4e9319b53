package com.jumbo.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One embedded SQLite database file behind a single shared connection, in WAL journal mode.
 *
 * <p>The connection is released by {@link #checkpointAndClose()}, which folds the write-ahead log
 * back into the main file first. Closing is idempotent.
 */
public class SqliteDatabase implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SqliteDatabase.class);

    private final Path path;
    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final AtomicBoolean closed = new AtomicBoolean();

    private SqliteDatabase(Path path, SingleConnectionDataSource dataSource) {
        this.path = path;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    }

    public static SqliteDatabase open(Path path) {
        Path absolute = path.toAbsolutePath();
        try {
            Files.createDirectories(absolute.getParent());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to create directory for database " + absolute, ex);
        }

        SingleConnectionDataSource dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + absolute, true);
        SqliteDatabase database = new SqliteDatabase(absolute, dataSource);
        try {
            String mode = database.jdbcTemplate.queryForObject("PRAGMA journal_mode = WAL", String.class);
            database.jdbcTemplate.execute("PRAGMA busy_timeout = 5000");
            log.debug("Opened database {} (journal_mode={})", absolute, mode);
        } catch (DataAccessException ex) {
            dataSource.destroy();
            throw ex;
        }
        return database;
    }

    /** The {@code -wal} and {@code -shm} companions of a database file. */
    public static List<Path> sidecarFiles(Path databaseFile) {
        String name = databaseFile.getFileName().toString();
        return List.of(
            databaseFile.resolveSibling(name + "-wal"),
            databaseFile.resolveSibling(name + "-shm"));
    }

    public Path getPath() {
        return path;
    }

    public JdbcTemplate getJdbcTemplate() {
        return jdbcTemplate;
    }

    public TransactionTemplate getTransactionTemplate() {
        return transactionTemplate;
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    public String journalMode() {
        return jdbcTemplate.queryForObject("PRAGMA journal_mode", String.class);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public void checkpointAndClose() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            jdbcTemplate.execute("PRAGMA wal_checkpoint(TRUNCATE)");
        } finally {
            dataSource.destroy();
            log.debug("Closed database {}", path);
        }
    }

    @Override
    public void close() {
        checkpointAndClose();
    }
}
