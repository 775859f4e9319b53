package com.jumbo.projection.session;

import java.util.List;
import java.util.Optional;

public interface SessionReader {

    Optional<SessionView> findById(String sessionId);

    /** All sessions, newest first; {@code status} null means any status. */
    List<SessionView> findAll(String status);
}
