package com.companya.sensorhub.model;

public enum ReplicationState {
    /** No sensor has a high-water mark yet; the next pass reads full history. */
    BOOTSTRAP,
    /** At least one sensor has a mark. */
    INCREMENTAL
}
