package com.companya.sensorhub.model;

import java.time.Instant;

/**
 * A reading whose temperature went above the configured threshold.
 * Appended once, never rewritten.
 */
public record CriticalEvent(
        Instant timestamp,
        String sensorId,
        double temperature) {

    public static CriticalEvent of(Reading reading) {
        return new CriticalEvent(reading.timestamp(), reading.sensorId(), reading.temperature());
    }
}
