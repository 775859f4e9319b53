package com.jumbo.local;

public interface EventClock {

    /** Current UTC time as {@code yyyy-MM-ddTHH:mm:ss.SSSZ}. */
    String nowIso();
}
