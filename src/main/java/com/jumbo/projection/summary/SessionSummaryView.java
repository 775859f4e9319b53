package com.jumbo.projection.summary;

import java.util.List;
import java.util.Map;

/**
 * Row of {@code session_summary_views}. The row keyed {@value SessionSummaryProjectionStore#LATEST}
 * always describes the most recently started session; earlier ones are archived under their own id.
 */
public record SessionSummaryView(
    String sessionId,
    String originalSessionId,
    String focus,
    String status,
    String contextSnapshot,
    List<Map<String, Object>> completedGoals,
    List<Map<String, Object>> blockersEncountered,
    List<Map<String, Object>> decisions,
    List<Map<String, Object>> goalsStarted,
    List<Map<String, Object>> goalsPaused,
    List<Map<String, Object>> goalsResumed,
    String createdAt,
    String updatedAt
) {

    public boolean isActive() {
        return "active".equals(status);
    }
}
