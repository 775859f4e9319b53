package com.jumbo.persistence;

import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;

import java.nio.charset.StandardCharsets;

/**
 * One versioned schema script of a namespace. Versions start at 1 and only ever grow.
 */
public record Migration(int version, String description, Resource script) {

    public Migration {
        if (version < 1) {
            throw new IllegalArgumentException("migration version must be >= 1, got " + version);
        }
        if (script == null) {
            throw new IllegalArgumentException("migration script is required");
        }
    }

    public static Migration ofSql(int version, String description, String sql) {
        return new Migration(version, description,
            new ByteArrayResource(sql.getBytes(StandardCharsets.UTF_8), description));
    }
}
