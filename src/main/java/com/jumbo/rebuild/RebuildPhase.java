package com.jumbo.rebuild;

public enum RebuildPhase {
    IDLE,
    CLOSING_OLD_CONNECTION,
    CREATING_FRESH_DATABASE,
    RUNNING_MIGRATIONS,
    WIRING_SEQUENTIAL_BUS,
    REPLAYING_LOG,
    DELETING_DATABASE_FILES,
    DONE,
    FAILED
}
