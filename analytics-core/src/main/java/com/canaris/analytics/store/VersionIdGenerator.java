package com.canaris.analytics.store;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Produces strictly increasing, lexicographically sortable version ids of the
 * form {@code yyyyMMdd_HHmmss_SSS} (UTC). Ids generated within the same
 * millisecond are pushed forward by one millisecond each.
 */
public class VersionIdGenerator {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS").withZone(ZoneOffset.UTC);

    private final Clock clock;
    private long lastMillis = Long.MIN_VALUE;

    public VersionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public VersionIdGenerator() {
        this(Clock.systemUTC());
    }

    public synchronized String next() {
        long now = clock.millis();
        lastMillis = Math.max(now, lastMillis + 1);
        return FORMAT.format(Instant.ofEpochMilli(lastMillis));
    }
}
