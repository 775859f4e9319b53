package com.jumbo.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Applies namespace migrations that have not been recorded in {@code schema_migrations} yet.
 *
 * <p>Each namespace runs in one transaction: either all of its pending scripts and their
 * bookkeeping rows are committed, or none are. Running again with nothing pending is a no-op.
 */
public class MigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private static final String CREATE_SCHEMA_MIGRATIONS = """
        CREATE TABLE IF NOT EXISTS schema_migrations (
            namespace TEXT NOT NULL,
            version INTEGER NOT NULL,
            description TEXT NOT NULL,
            appliedAt TEXT NOT NULL,
            PRIMARY KEY (namespace, version)
        )
        """;

    private final DataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    public MigrationRunner(SqliteDatabase database) {
        this(database.getDataSource(), database.getJdbcTemplate(), database.getTransactionTemplate());
    }

    public MigrationRunner(DataSource dataSource, JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        this.dataSource = dataSource;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * @return number of scripts applied by this call
     * @throws MigrationFailureException when a script fails; earlier namespaces stay applied
     */
    public int runNamespaceMigrations(List<NamespaceMigrations> namespaces) {
        jdbcTemplate.execute(CREATE_SCHEMA_MIGRATIONS);

        int applied = 0;
        for (NamespaceMigrations namespace : namespaces) {
            applied += runNamespace(namespace);
        }
        if (applied > 0) {
            log.info("Applied {} migration(s) across {} namespace(s)", applied, namespaces.size());
        }
        return applied;
    }

    public Set<Integer> appliedVersions(String namespace) {
        jdbcTemplate.execute(CREATE_SCHEMA_MIGRATIONS);
        return new HashSet<>(jdbcTemplate.queryForList(
            "SELECT version FROM schema_migrations WHERE namespace = ?", Integer.class, namespace));
    }

    private int runNamespace(NamespaceMigrations namespace) {
        Set<Integer> done = appliedVersions(namespace.namespace());
        List<Migration> pending = namespace.migrations().stream()
            .filter(migration -> !done.contains(migration.version()))
            .toList();
        if (pending.isEmpty()) {
            return 0;
        }

        int[] current = {0};
        try {
            transactionTemplate.executeWithoutResult(status -> {
                Connection connection = DataSourceUtils.getConnection(dataSource);
                try {
                    for (Migration migration : pending) {
                        current[0] = migration.version();
                        ScriptUtils.executeSqlScript(connection, migration.script());
                        jdbcTemplate.update(
                            "INSERT INTO schema_migrations (namespace, version, description, appliedAt) VALUES (?, ?, ?, ?)",
                            namespace.namespace(), migration.version(), migration.description(),
                            Instant.now().toString());
                        log.debug("Applied migration {} V{} ({})",
                            namespace.namespace(), migration.version(), migration.description());
                    }
                } finally {
                    DataSourceUtils.releaseConnection(connection, dataSource);
                }
            });
        } catch (DataAccessException ex) {
            throw new MigrationFailureException(namespace.namespace(), current[0], ex);
        }
        return pending.size();
    }
}
