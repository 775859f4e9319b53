package com.jumbo.persistence;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SqliteDatabaseTest {

    @TempDir
    Path dir;

    @Test
    void opensInWalModeAndCreatesMissingDirectories() {
        Path file = dir.resolve("nested/jumbo.db");
        SqliteDatabase database = SqliteDatabase.open(file);
        try {
            assertEquals("wal", database.journalMode().toLowerCase());
            assertTrue(Files.exists(file));
        } finally {
            database.checkpointAndClose();
        }
    }

    @Test
    void checkpointAndClose_isIdempotent_andFoldsTheWalBack() {
        Path file = dir.resolve("jumbo.db");
        SqliteDatabase database = SqliteDatabase.open(file);
        database.getJdbcTemplate().execute("CREATE TABLE t (id INTEGER PRIMARY KEY)");
        database.getJdbcTemplate().update("INSERT INTO t (id) VALUES (1)");

        database.checkpointAndClose();
        assertDoesNotThrow(database::checkpointAndClose);
        assertTrue(database.isClosed());

        Path wal = SqliteDatabase.sidecarFiles(file).get(0);
        assertTrue(!Files.exists(wal) || wal.toFile().length() == 0);

        SqliteDatabase reopened = SqliteDatabase.open(file);
        try {
            assertEquals(1, reopened.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM t", Integer.class));
        } finally {
            reopened.close();
        }
    }

    @Test
    void sidecarFiles_areWalAndShm() {
        Path file = dir.resolve("jumbo.db");
        assertEquals(
            java.util.List.of(dir.resolve("jumbo.db-wal"), dir.resolve("jumbo.db-shm")),
            SqliteDatabase.sidecarFiles(file));
    }
}
