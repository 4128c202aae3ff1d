package com.companya.sensorhub.service;

import com.companya.sensorhub.config.SensorHubProperties;
import com.companya.sensorhub.exception.MalformedMessageException;
import com.companya.sensorhub.model.Reading;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Turns a raw inbound payload into a {@link Reading}.
 *
 * <p>Expected payload: a UTF-8 JSON object with {@code id} (string),
 * {@code timestamp} (ISO-8601 date-time) and {@code temperature} (number).
 * Timestamps without an offset are read in the configured default zone.</p>
 */
@Component
public class ReadingMessageDecoder {

    static final int MAX_SENSOR_ID_LENGTH = 50;

    private final ObjectReader reader;
    private final ZoneId defaultZone;

    @Autowired
    public ReadingMessageDecoder(ObjectMapper objectMapper, SensorHubProperties properties) {
        this(objectMapper, properties.getIngest().zone());
    }

    public ReadingMessageDecoder(ObjectMapper objectMapper, ZoneId defaultZone) {
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.defaultZone = defaultZone;
    }

    public Reading decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new MalformedMessageException("Empty payload");
        }

        JsonNode root;
        try {
            root = reader.readTree(utf8(payload));
        } catch (JsonProcessingException ex) {
            throw new MalformedMessageException("Payload is not valid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMessageException("Payload is not a JSON object");
        }

        String sensorId = sensorId(root.get("id"));
        Instant timestamp = timestamp(root.get("timestamp"));
        double temperature = temperature(root.get("temperature"));
        return new Reading(sensorId, timestamp, temperature);
    }

    private static String utf8(byte[] payload) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new MalformedMessageException("Payload is not valid UTF-8", ex);
        }
    }

    private static String sensorId(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new MalformedMessageException("Missing field 'id'");
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new MalformedMessageException("Field 'id' must be a non-blank string");
        }
        String id = node.asText();
        if (id.length() > MAX_SENSOR_ID_LENGTH) {
            throw new MalformedMessageException("Field 'id' is longer than " + MAX_SENSOR_ID_LENGTH + " characters");
        }
        return id;
    }

    private Instant timestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new MalformedMessageException("Missing field 'timestamp'");
        }
        if (!node.isTextual()) {
            throw new MalformedMessageException("Field 'timestamp' must be an ISO-8601 string");
        }
        String text = node.asText();
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).atZone(defaultZone).toInstant();
        } catch (DateTimeParseException ex) {
            throw new MalformedMessageException("Field 'timestamp' is not an ISO-8601 date-time: '" + text + "'", ex);
        }
    }

    private static double temperature(JsonNode node) {
        if (node == null || node.isNull()) {
            throw new MalformedMessageException("Missing field 'temperature'");
        }
        if (!node.isNumber()) {
            throw new MalformedMessageException("Field 'temperature' must be a number");
        }
        double value = node.doubleValue();
        // stored as a 32-bit float
        if (!Double.isFinite(value) || Math.abs(value) > Float.MAX_VALUE) {
            throw new MalformedMessageException("Field 'temperature' is out of range: " + node.asText());
        }
        return value;
    }
}
