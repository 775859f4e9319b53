package com.jumbo.local;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

public class SystemEventClock implements EventClock {

    private static final DateTimeFormatter ISO_MILLIS =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final Clock clock;

    public SystemEventClock() {
        this(Clock.systemUTC());
    }

    public SystemEventClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String nowIso() {
        return ISO_MILLIS.format(clock.instant());
    }
}
