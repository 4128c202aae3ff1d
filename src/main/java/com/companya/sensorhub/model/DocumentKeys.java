package com.companya.sensorhub.model;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Builds search document ids of the form {@code <sensorId>_<uuuu-MM-dd'T'HH:mm:ss>}.
 * The timestamp is rendered in UTC at second precision, so the same
 * (sensor, timestamp) pair always maps to the same id and a re-index overwrites.
 */
public final class DocumentKeys {

    private static final DateTimeFormatter KEY_TIMESTAMP =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private DocumentKeys() {
    }

    public static String of(String sensorId, Instant timestamp) {
        return sensorId + "_" + KEY_TIMESTAMP.format(timestamp);
    }
}
