package com.jumbo.rebuild;

/**
 * Recreates every projection from the event log.
 */
public interface DatabaseRebuildService {

    /**
     * @throws ReplayFailureException when an envelope could not be applied; the previous
     *         database is left in place
     */
    DatabaseRebuildResult rebuild();
}
