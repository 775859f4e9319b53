package com.jumbo.projection.decision;

import com.jumbo.projection.JdbcProjectionStore;
import com.jumbo.projection.JsonColumns;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class DecisionProjectionStore extends JdbcProjectionStore implements DecisionReader {

    private static final Set<String> UPDATABLE = Set.of(
        "title", "context", "rationale", "alternatives", "consequences", "status", "supersededBy",
        "reversalReason", "reversedAt", "version", "updatedAt");

    private final RowMapper<DecisionView> rowMapper = (rs, rowNum) -> new DecisionView(
        rs.getString("decisionId"),
        rs.getString("title"),
        rs.getString("context"),
        rs.getString("rationale"),
        json.readStrings(rs.getString("alternatives")),
        rs.getString("consequences"),
        rs.getString("status"),
        rs.getString("supersededBy"),
        rs.getString("reversalReason"),
        rs.getString("reversedAt"),
        rs.getLong("version"),
        rs.getString("createdAt"),
        rs.getString("updatedAt")
    );

    public DecisionProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        super(jdbcTemplate, json, "decision_views", "decisionId", UPDATABLE);
    }

    public void insert(DecisionView decision) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO decision_views (
                decisionId, title, context, rationale, alternatives, consequences, status,
                supersededBy, reversalReason, reversedAt, version, createdAt, updatedAt
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            decision.decisionId(),
            decision.title(),
            decision.context(),
            decision.rationale(),
            json.writeList(decision.alternatives()),
            decision.consequences(),
            decision.status(),
            decision.supersededBy(),
            decision.reversalReason(),
            decision.reversedAt(),
            decision.version(),
            decision.createdAt(),
            decision.updatedAt());
    }

    @Override
    public Optional<DecisionView> findById(String decisionId) {
        return jdbcTemplate.query("SELECT * FROM decision_views WHERE decisionId = ?", rowMapper, decisionId)
            .stream()
            .findFirst();
    }

    @Override
    public List<DecisionView> findAll(String status) {
        if (status == null) {
            return jdbcTemplate.query("SELECT * FROM decision_views ORDER BY createdAt DESC, decisionId", rowMapper);
        }
        return jdbcTemplate.query(
            "SELECT * FROM decision_views WHERE status = ? ORDER BY createdAt DESC, decisionId", rowMapper, status);
    }
}
