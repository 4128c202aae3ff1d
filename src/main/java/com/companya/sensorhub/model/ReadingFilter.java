package com.companya.sensorhub.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Row selection for a replication pass. Each entry bounds one sensor to rows
 * strictly newer than the given instant; sensors without an entry are unbounded.
 * An empty filter selects everything.
 */
public record ReadingFilter(Map<String, Instant> newerThan) {

    public ReadingFilter {
        newerThan = Collections.unmodifiableMap(new LinkedHashMap<>(newerThan));
    }

    public static ReadingFilter unrestricted() {
        return new ReadingFilter(Map.of());
    }

    public boolean isUnrestricted() {
        return newerThan.isEmpty();
    }
}
