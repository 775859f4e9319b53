package com.jumbo.projection.session;

public record SessionView(
    String sessionId,
    String focus,
    String status,
    String contextSnapshot,
    long version,
    String startedAt,
    String endedAt,
    String createdAt,
    String updatedAt
) {
}
