package com.jumbo.projection.summary;

import java.util.Optional;

public interface SessionSummaryReader {

    Optional<SessionSummaryView> findLatest();

    /** The summary of one session, whether it is the latest one or already archived. */
    Optional<SessionSummaryView> findByOriginalId(String sessionId);
}
