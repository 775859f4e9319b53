package com.jumbo.projection.invariant;

import com.jumbo.projection.JdbcProjectionStore;
import com.jumbo.projection.JsonColumns;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class InvariantProjectionStore extends JdbcProjectionStore implements InvariantReader {

    private static final Set<String> UPDATABLE = Set.of(
        "title", "description", "rationale", "enforcement", "version", "updatedAt");

    private static final RowMapper<InvariantView> ROW_MAPPER = (rs, rowNum) -> new InvariantView(
        rs.getString("invariantId"),
        rs.getString("title"),
        rs.getString("description"),
        rs.getString("rationale"),
        rs.getString("enforcement"),
        rs.getLong("version"),
        rs.getString("createdAt"),
        rs.getString("updatedAt")
    );

    public InvariantProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        super(jdbcTemplate, json, "invariant_views", "invariantId", UPDATABLE);
    }

    public void insert(InvariantView invariant) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO invariant_views (
                invariantId, title, description, rationale, enforcement, version, createdAt, updatedAt
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """,
            invariant.invariantId(),
            invariant.title(),
            invariant.description(),
            invariant.rationale(),
            invariant.enforcement(),
            invariant.version(),
            invariant.createdAt(),
            invariant.updatedAt());
    }

    @Override
    public Optional<InvariantView> findById(String invariantId) {
        return jdbcTemplate.query("SELECT * FROM invariant_views WHERE invariantId = ?", ROW_MAPPER, invariantId)
            .stream()
            .findFirst();
    }

    @Override
    public List<InvariantView> findAll() {
        return jdbcTemplate.query("SELECT * FROM invariant_views ORDER BY createdAt, invariantId", ROW_MAPPER);
    }
}
