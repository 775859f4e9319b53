package com.jumbo.projection.architecture;

import com.jumbo.projection.JdbcProjectionStore;
import com.jumbo.projection.JsonColumns;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.Optional;
import java.util.Set;

public class ArchitectureProjectionStore extends JdbcProjectionStore implements ArchitectureReader {

    private static final Set<String> UPDATABLE = Set.of(
        "description", "organization", "patterns", "principles", "dataStores", "stack", "version", "updatedAt");

    private final RowMapper<ArchitectureView> rowMapper = (rs, rowNum) -> new ArchitectureView(
        rs.getString("architectureId"),
        rs.getString("description"),
        rs.getString("organization"),
        json.readStrings(rs.getString("patterns")),
        json.readStrings(rs.getString("principles")),
        json.readEntries(rs.getString("dataStores")),
        json.readStrings(rs.getString("stack")),
        rs.getLong("version"),
        rs.getString("createdAt"),
        rs.getString("updatedAt")
    );

    public ArchitectureProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        super(jdbcTemplate, json, "architecture_views", "architectureId", UPDATABLE);
    }

    public void insert(ArchitectureView architecture) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO architecture_views (
                architectureId, description, organization, patterns, principles, dataStores, stack,
                version, createdAt, updatedAt
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            architecture.architectureId(),
            architecture.description(),
            architecture.organization(),
            json.writeList(architecture.patterns()),
            json.writeList(architecture.principles()),
            json.writeList(architecture.dataStores()),
            json.writeList(architecture.stack()),
            architecture.version(),
            architecture.createdAt(),
            architecture.updatedAt());
    }

    @Override
    public Optional<ArchitectureView> find() {
        return jdbcTemplate.query("SELECT * FROM architecture_views ORDER BY createdAt LIMIT 1", rowMapper)
            .stream()
            .findFirst();
    }
}
