package com.jumbo.projection.summary;

import com.jumbo.projection.JdbcProjectionStore;
import com.jumbo.projection.JsonColumns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class SessionSummaryProjectionStore extends JdbcProjectionStore implements SessionSummaryReader {

    private static final Logger log = LoggerFactory.getLogger(SessionSummaryProjectionStore.class);

    public static final String LATEST = "LATEST";

    private static final Set<String> UPDATABLE = Stream.concat(
            Stream.of("focus", "status", "contextSnapshot", "updatedAt"),
            Arrays.stream(SummaryList.values()).map(SummaryList::getColumn))
        .collect(Collectors.toUnmodifiableSet());

    private static final String COLUMNS = """
        originalSessionId, focus, status, contextSnapshot, completedGoals, blockersEncountered,
        decisions, goalsStarted, goalsPaused, goalsResumed, createdAt, updatedAt""";

    private final RowMapper<SessionSummaryView> rowMapper = (rs, rowNum) -> new SessionSummaryView(
        rs.getString("sessionId"),
        rs.getString("originalSessionId"),
        rs.getString("focus"),
        rs.getString("status"),
        rs.getString("contextSnapshot"),
        json.readEntries(rs.getString("completedGoals")),
        json.readEntries(rs.getString("blockersEncountered")),
        json.readEntries(rs.getString("decisions")),
        json.readEntries(rs.getString("goalsStarted")),
        json.readEntries(rs.getString("goalsPaused")),
        json.readEntries(rs.getString("goalsResumed")),
        rs.getString("createdAt"),
        rs.getString("updatedAt")
    );

    public SessionSummaryProjectionStore(JdbcTemplate jdbcTemplate, JsonColumns json) {
        super(jdbcTemplate, json, "session_summary_views", "sessionId", UPDATABLE);
    }

    public void upsertLatest(SessionSummaryView summary) {
        jdbcTemplate.update("INSERT OR REPLACE INTO session_summary_views (sessionId, " + COLUMNS + ")"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            LATEST,
            summary.originalSessionId(),
            summary.focus(),
            summary.status(),
            summary.contextSnapshot(),
            json.writeList(summary.completedGoals()),
            json.writeList(summary.blockersEncountered()),
            json.writeList(summary.decisions()),
            json.writeList(summary.goalsStarted()),
            json.writeList(summary.goalsPaused()),
            json.writeList(summary.goalsResumed()),
            summary.createdAt(),
            summary.updatedAt());
    }

    /**
     * Copies the current {@code LATEST} row to a row keyed by its original session id.
     * A no-op when there is no latest summary.
     */
    public void archiveLatest() {
        int archived = jdbcTemplate.update("INSERT OR REPLACE INTO session_summary_views (sessionId, " + COLUMNS + ")"
            + " SELECT originalSessionId, " + COLUMNS
            + " FROM session_summary_views WHERE sessionId = ?", LATEST);
        if (archived > 0) {
            log.debug("Archived latest session summary");
        }
    }

    public int updateLatestStatus(String status, String updatedAt) {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put("status", status);
        changes.put("updatedAt", updatedAt);
        return updateColumns(LATEST, changes);
    }

    public void appendToLatest(SummaryList list, Map<String, Object> entry, String updatedAt) {
        SessionSummaryView latest = findLatest().orElse(null);
        if (latest == null) {
            return;
        }
        List<Map<String, Object>> entries = new ArrayList<>(entriesOf(latest, list));
        entries.add(entry);
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(list.getColumn(), json.writeList(entries));
        changes.put("updatedAt", updatedAt);
        updateColumns(LATEST, changes);
    }

    @Override
    public Optional<SessionSummaryView> findLatest() {
        return jdbcTemplate.query("SELECT * FROM session_summary_views WHERE sessionId = ?", rowMapper, LATEST)
            .stream()
            .findFirst();
    }

    @Override
    public Optional<SessionSummaryView> findByOriginalId(String sessionId) {
        return jdbcTemplate.query("""
                SELECT * FROM session_summary_views
                WHERE originalSessionId = ?
                ORDER BY CASE WHEN sessionId = ? THEN 0 ELSE 1 END
                LIMIT 1
                """, rowMapper, sessionId, LATEST)
            .stream()
            .findFirst();
    }

    private static List<Map<String, Object>> entriesOf(SessionSummaryView summary, SummaryList list) {
        return switch (list) {
            case COMPLETED_GOALS -> summary.completedGoals();
            case BLOCKERS_ENCOUNTERED -> summary.blockersEncountered();
            case DECISIONS -> summary.decisions();
            case GOALS_STARTED -> summary.goalsStarted();
            case GOALS_PAUSED -> summary.goalsPaused();
            case GOALS_RESUMED -> summary.goalsResumed();
        };
    }
}
