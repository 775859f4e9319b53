package com.jumbo.projection.goal;

import com.jumbo.projection.JdbcProjectionStore;
import com.jumbo.projection.JsonColumns;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class GoalProjectionStore extends JdbcProjectionStore implements GoalReader {

    private static final Set<String> UPDATABLE = Set.of(
        "objective", "successCriteria", "scopeIn", "scopeOut", "boundaries", "status", "note",
        "claimedBy", "claimedAt", "claimExpiresAt", "embeddedContext", "progress", "nextGoalId",
        "version", "updatedAt");

    private static final String SELECT = """
        SELECT goalId, objective, successCriteria, scopeIn, scopeOut, boundaries, status, note,
               claimedBy, claimedAt, claimExpiresAt, embeddedContext, progress, nextGoalId,
               version, createdAt, updatedAt
        FROM goal_views
        """;

    private final RowMapper<GoalView> rowMapper = (rs, rowNum) -> new GoalView(
        rs.getString("goalId"),
        rs.getString("objective"),
        json.readStrings(rs.getString("successCriteria")),
        json.readStrings(rs.getString("scopeIn")),
        json.readStrings(rs.getString("scopeOut")),
        json.readStrings(rs.getString("boundaries")),
        rs.getString("status"),
        rs.getString("note"),
        rs.getString("claimedBy"),
        rs.getString("claimedAt"),
        rs.getString("claimExpiresAt"),
        json.readObject(rs.getString("embeddedContext")),
        json.readStrings(rs.getString("progress")),
        rs.getString("nextGoalId"),
        rs.getLong("version"),
        rs.getString("createdAt"),
        rs.getString("updatedAt")
    );

    public GoalProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        super(jdbcTemplate, json, "goal_views", "goalId", UPDATABLE);
    }

    public void insert(GoalView goal) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO goal_views (
                goalId, objective, successCriteria, scopeIn, scopeOut, boundaries, status, note,
                claimedBy, claimedAt, claimExpiresAt, embeddedContext, progress, nextGoalId,
                version, createdAt, updatedAt
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            goal.goalId(),
            goal.objective(),
            json.writeList(goal.successCriteria()),
            json.writeList(goal.scopeIn()),
            json.writeList(goal.scopeOut()),
            json.writeList(goal.boundaries()),
            goal.status(),
            goal.note(),
            goal.claimedBy(),
            goal.claimedAt(),
            goal.claimExpiresAt(),
            json.write(goal.embeddedContext()),
            json.writeList(goal.progress()),
            goal.nextGoalId(),
            goal.version(),
            goal.createdAt(),
            goal.updatedAt());
    }

    @Override
    public Optional<GoalView> findById(String goalId) {
        return jdbcTemplate.query(SELECT + " WHERE goalId = ?", rowMapper, goalId).stream().findFirst();
    }

    @Override
    public List<GoalView> findByStatus(String status) {
        return jdbcTemplate.query(SELECT + " WHERE status = ? ORDER BY createdAt, goalId", rowMapper, status);
    }

    @Override
    public List<GoalView> findAll() {
        return jdbcTemplate.query(SELECT + " ORDER BY createdAt, goalId", rowMapper);
    }
}
