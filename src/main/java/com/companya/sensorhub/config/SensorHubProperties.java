package com.companya.sensorhub.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Deployment settings bound from the {@code app.*} namespace.
 * None of these change the ingest or replication algorithms, only where they point.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class SensorHubProperties {

    static final String SQL_IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]{0,62}";

    @Valid
    private Transport transport = new Transport();

    @Valid
    private Ingest ingest = new Ingest();

    @Valid
    private PrimaryStore primaryStore = new PrimaryStore();

    @Valid
    private SecondaryStore secondaryStore = new SecondaryStore();

    @Valid
    private Replication replication = new Replication();

    @Data
    public static class Transport {
        @NotBlank
        private String topic = "sensors.temperature";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Ingest {
        private boolean enabled = true;
        private double threshold = 25;
        @NotBlank
        private String criticalEventsFile = "data/critical_hardware.csv";
        @NotBlank
        private String defaultZone = "UTC";
        private boolean dualWrite = false;

        public Path criticalEventsPath() {
            return Path.of(criticalEventsFile);
        }

        public ZoneId zone() {
            return ZoneId.of(defaultZone);
        }
    }

    @Data
    public static class PrimaryStore {
        @NotBlank
        @Pattern(regexp = SQL_IDENTIFIER)
        private String table = "sensor_readings";
        @NotNull
        private Duration reconnectInterval = Duration.ofSeconds(5);
    }

    @Data
    public static class SecondaryStore {
        @NotBlank
        private String host = "localhost";
        @Min(1)
        @Max(65535)
        private int port = 9200;
        private String username;
        private String password;
        private boolean useSsl = true;
        private String sslBundle = "secondary-store";
        @NotBlank
        private String index = "sensor_readings";
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);
        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        public String baseUrl() {
            return (useSsl ? "https" : "http") + "://" + host + ":" + port;
        }
    }

    @Data
    public static class Replication {
        private boolean enabled = true;
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(15);
        @Valid
        private Checkpoint checkpoint = new Checkpoint();
    }

    @Data
    public static class Checkpoint {
        private boolean enabled = false;
    }
}
