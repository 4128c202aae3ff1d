package com.companya.sensorhub.service;

import com.companya.sensorhub.model.ReadingFilter;
import com.companya.sensorhub.model.ReplicationState;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-sensor timestamp of the newest reading confirmed in the secondary store.
 * Marks only move forward.
 */
public class HighWaterMarks {

    private final Map<String, Instant> marks = new TreeMap<>();

    public ReplicationState state() {
        return marks.isEmpty() ? ReplicationState.BOOTSTRAP : ReplicationState.INCREMENTAL;
    }

    public ReadingFilter toFilter() {
        return marks.isEmpty() ? ReadingFilter.unrestricted() : new ReadingFilter(marks);
    }

    /**
     * Raises each sensor's mark to the given instant; an older instant leaves the mark unchanged.
     */
    public void advance(Map<String, Instant> observed) {
        observed.forEach((sensorId, timestamp) -> marks.merge(sensorId, timestamp,
                (current, candidate) -> candidate.isAfter(current) ? candidate : current));
    }

    public Map<String, Instant> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(marks));
    }

    public int size() {
        return marks.size();
    }
}
