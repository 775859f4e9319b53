package com.jumbo.projection.session;

import com.jumbo.projection.JdbcProjectionStore;
import com.jumbo.projection.JsonColumns;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;
import java.util.Set;

public class SessionProjectionStore extends JdbcProjectionStore implements SessionReader {

    private static final Set<String> UPDATABLE = Set.of(
        "focus", "status", "contextSnapshot", "endedAt", "version", "updatedAt");

    private static final RowMapper<SessionView> ROW_MAPPER = (rs, rowNum) -> new SessionView(
        rs.getString("sessionId"),
        rs.getString("focus"),
        rs.getString("status"),
        rs.getString("contextSnapshot"),
        rs.getLong("version"),
        rs.getString("startedAt"),
        rs.getString("endedAt"),
        rs.getString("createdAt"),
        rs.getString("updatedAt")
    );

    public SessionProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        super(jdbcTemplate, json, "session_views", "sessionId", UPDATABLE);
    }

    public void insert(SessionView session) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO session_views (
                sessionId, focus, status, contextSnapshot, version, startedAt, endedAt, createdAt, updatedAt
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """,
            session.sessionId(),
            session.focus(),
            session.status(),
            session.contextSnapshot(),
            session.version(),
            session.startedAt(),
            session.endedAt(),
            session.createdAt(),
            session.updatedAt());
    }

    @Override
    public Optional<SessionView> findById(String sessionId) {
        return jdbcTemplate.query("SELECT * FROM session_views WHERE sessionId = ?", ROW_MAPPER, sessionId)
            .stream()
            .findFirst();
    }

    @Override
    public List<SessionView> findAll(String status) {
        if (status == null) {
            return jdbcTemplate.query("SELECT * FROM session_views ORDER BY startedAt DESC, sessionId", ROW_MAPPER);
        }
        return jdbcTemplate.query(
            "SELECT * FROM session_views WHERE status = ? ORDER BY startedAt DESC, sessionId", ROW_MAPPER, status);
    }
}
