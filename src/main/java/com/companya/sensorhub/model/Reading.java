package com.companya.sensorhub.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One sensor observation. Duplicates are legal; nothing here is unique.
 */
public record Reading(
        String sensorId,
        Instant timestamp,
        double temperature) {

    public Reading {
        Objects.requireNonNull(sensorId, "sensorId");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
