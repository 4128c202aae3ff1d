package com.companya.sensorhub.service;

import com.companya.sensorhub.exception.MalformedMessageException;
import com.companya.sensorhub.model.Reading;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReadingMessageDecoder Tests")
class ReadingMessageDecoderTest {

    private final ReadingMessageDecoder decoder = new ReadingMessageDecoder(new ObjectMapper(), ZoneId.of("UTC"));

    private static byte[] json(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Valid payloads")
    class Valid {

        @Test
        @DisplayName("Local timestamp is read in the default zone")
        void localTimestamp() {
            Reading reading = decoder.decode(json(
                    "{\"id\":\"id_1\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":30}"));

            assertThat(reading.sensorId()).isEqualTo("id_1");
            assertThat(reading.timestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
            assertThat(reading.temperature()).isEqualTo(30.0);
        }

        @Test
        @DisplayName("Explicit offset is honoured")
        void offsetTimestamp() {
            Reading reading = decoder.decode(json(
                    "{\"id\":\"id_2\",\"timestamp\":\"2024-01-01T02:00:00+02:00\",\"temperature\":21.5}"));

            assertThat(reading.timestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
            assertThat(reading.temperature()).isEqualTo(21.5);
        }

        @Test
        void otherDefaultZone() {
            ReadingMessageDecoder berlin = new ReadingMessageDecoder(new ObjectMapper(), ZoneId.of("Europe/Berlin"));

            Reading reading = berlin.decode(json(
                    "{\"id\":\"id_1\",\"timestamp\":\"2024-01-01T01:00:00\",\"temperature\":1}"));

            assertThat(reading.timestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
        }

        @Test
        void negativeTemperature() {
            Reading reading = decoder.decode(json(
                    "{\"id\":\"freezer\",\"timestamp\":\"2024-01-01T00:00:00Z\",\"temperature\":-18.25}"));

            assertThat(reading.temperature()).isEqualTo(-18.25);
        }
    }

    @Nested
    @DisplayName("Malformed payloads")
    class Malformed {

        @ParameterizedTest
        @ValueSource(strings = {
                "",
                "not json",
                "[1,2,3]",
                "{\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":1}",
                "{\"id\":\"  \",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":1}",
                "{\"id\":7,\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":1}",
                "{\"id\":\"a\",\"temperature\":1}",
                "{\"id\":\"a\",\"timestamp\":\"yesterday\",\"temperature\":1}",
                "{\"id\":\"a\",\"timestamp\":1704067200,\"temperature\":1}",
                "{\"id\":\"a\",\"timestamp\":\"2024-01-01T00:00:00\"}",
                "{\"id\":\"a\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":\"hot\"}",
                "{\"id\":\"a\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":null}",
                "{\"id\":\"a\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":1e400}"
        })
        void rejected(String payload) {
            assertThatThrownBy(() -> decoder.decode(json(payload)))
                    .isInstanceOf(MalformedMessageException.class);
        }

        @Test
        void nullPayload() {
            assertThatThrownBy(() -> decoder.decode(null))
                    .isInstanceOf(MalformedMessageException.class)
                    .hasMessage("Empty payload");
        }

        @Test
        void invalidUtf8() {
            byte[] payload = {'{', '"', 'i', 'd', '"', ':', '"', (byte) 0xC3, (byte) 0x28, '"', '}'};

            assertThatThrownBy(() -> decoder.decode(payload))
                    .isInstanceOf(MalformedMessageException.class)
                    .hasMessageContaining("UTF-8");
        }

        @ParameterizedTest
        @ValueSource(strings = {"1e39", "-1e39", "3.5e38"})
        @DisplayName("Temperature outside the 32-bit float range is rejected")
        void temperatureBeyondFloatRange(String temperature) {
            assertThatThrownBy(() -> decoder.decode(json(
                    "{\"id\":\"a\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":" + temperature + "}")))
                    .isInstanceOf(MalformedMessageException.class)
                    .hasMessageContaining("out of range");
        }

        @Test
        void largestFloatIsAccepted() {
            Reading reading = decoder.decode(json(
                    "{\"id\":\"a\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":" + (double) Float.MAX_VALUE + "}"));

            assertThat(reading.temperature()).isEqualTo((double) Float.MAX_VALUE);
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"id\":\"a\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":1}garbage",
                "{\"id\":\"a\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":1}{}",
                "{\"id\":\"a\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":1} 2"
        })
        @DisplayName("Content after the JSON object is rejected")
        void trailingContent(String payload) {
            assertThatThrownBy(() -> decoder.decode(json(payload)))
                    .isInstanceOf(MalformedMessageException.class)
                    .hasMessageContaining("not valid JSON");
        }

        @Test
        @DisplayName("Sensor id longer than the column width is rejected")
        void idTooLong() {
            String id = "x".repeat(ReadingMessageDecoder.MAX_SENSOR_ID_LENGTH + 1);

            assertThatThrownBy(() -> decoder.decode(json(
                    "{\"id\":\"" + id + "\",\"timestamp\":\"2024-01-01T00:00:00\",\"temperature\":1}")))
                    .isInstanceOf(MalformedMessageException.class)
                    .hasMessageContaining("longer than");
        }
    }
}
