package com.companya.sensorhub.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.format.DateTimeFormatter;

/**
 * Shape of a reading in the search index: {@code {id, timestamp, temperature}}.
 */
public record ReadingDocument(
        @JsonIgnore String documentId,
        @JsonProperty("id") String sensorId,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("temperature") double temperature) {

    public static ReadingDocument from(Reading reading) {
        return new ReadingDocument(
                DocumentKeys.of(reading.sensorId(), reading.timestamp()),
                reading.sensorId(),
                DateTimeFormatter.ISO_INSTANT.format(reading.timestamp()),
                reading.temperature());
    }
}
