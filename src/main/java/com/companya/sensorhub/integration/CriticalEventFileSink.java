package com.companya.sensorhub.integration;

import com.companya.sensorhub.config.SensorHubProperties;
import com.companya.sensorhub.model.CriticalEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeFormatter;

/**
 * Append-only CSV log of critical readings. The header row is written only
 * when the file is first created.
 */
@Slf4j
@Component
public class CriticalEventFileSink {

    static final String HEADER = "timestamp,id,temperature";

    private final Path file;

    @Autowired
    public CriticalEventFileSink(SensorHubProperties properties) {
        this(properties.getIngest().criticalEventsPath());
    }

    public CriticalEventFileSink(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public synchronized void append(CriticalEvent event) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        boolean created = !Files.exists(file);
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
            if (created) {
                writer.write(HEADER);
                writer.write('\n');
                log.info("Created critical event file {}", file);
            }
            writer.write(String.join(",",
                    DateTimeFormatter.ISO_INSTANT.format(event.timestamp()),
                    csvField(event.sensorId()),
                    String.valueOf(event.temperature())));
            writer.write('\n');
        }
    }

    private static String csvField(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
