package com.companya.sensorhub.service;

import com.companya.sensorhub.config.SecondaryStoreConfig;
import com.companya.sensorhub.config.SensorHubProperties;
import com.companya.sensorhub.exception.MalformedMessageException;
import com.companya.sensorhub.exception.PrimaryStoreException;
import com.companya.sensorhub.exception.SecondaryStoreException;
import com.companya.sensorhub.integration.CriticalEventFileSink;
import com.companya.sensorhub.integration.SecondaryStoreClient;
import com.companya.sensorhub.model.CriticalEvent;
import com.companya.sensorhub.model.Reading;
import com.companya.sensorhub.model.ReadingDocument;
import com.companya.sensorhub.repository.ReadingStore;
import com.companya.sensorhub.repository.StoreConnection;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Processes one inbound message at a time: decode, alert, persist.
 *
 * <p>A message that fails at any step is logged and dropped; nothing is retried and
 * the next message is handled normally. When the primary store rejects a write the
 * handler reconnects before returning, so the following message gets a fresh connection.</p>
 *
 * <p>Not thread-safe. The listener container delivers on a single consumer thread.</p>
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ingest.enabled", havingValue = "true", matchIfMissing = true)
public class IngestHandler {

    private final ReadingMessageDecoder decoder;
    private final ReadingStore readingStore;
    private final CriticalEventFileSink criticalEventSink;
    private final SecondaryStoreClient secondaryStore;
    private final IngestMetrics metrics;
    private final double threshold;
    private final boolean dualWrite;

    private StoreConnection connection;

    @Autowired
    public IngestHandler(ReadingMessageDecoder decoder,
                         ReadingStore readingStore,
                         CriticalEventFileSink criticalEventSink,
                         @Qualifier(SecondaryStoreConfig.INGEST_CLIENT) SecondaryStoreClient secondaryStore,
                         IngestMetrics metrics,
                         SensorHubProperties properties) {
        this(decoder, readingStore, criticalEventSink, secondaryStore, metrics,
                properties.getIngest().getThreshold(), properties.getIngest().isDualWrite());
    }

    public IngestHandler(ReadingMessageDecoder decoder,
                         ReadingStore readingStore,
                         CriticalEventFileSink criticalEventSink,
                         SecondaryStoreClient secondaryStore,
                         IngestMetrics metrics,
                         double threshold,
                         boolean dualWrite) {
        this.decoder = decoder;
        this.readingStore = readingStore;
        this.criticalEventSink = criticalEventSink;
        this.secondaryStore = secondaryStore;
        this.metrics = metrics;
        this.threshold = threshold;
        this.dualWrite = dualWrite;
    }

    /**
     * Opens the primary store connection if none is held. Blocks until the store is reachable.
     */
    public void open() {
        if (connection == null) {
            connection = readingStore.connect();
        }
    }

    @PreDestroy
    public void close() {
        if (connection != null) {
            connection.close();
            connection = null;
        }
    }

    public void handle(byte[] payload) {
        metrics.recordReceived();

        Reading reading;
        try {
            reading = decoder.decode(payload);
        } catch (MalformedMessageException ex) {
            metrics.recordMalformed();
            log.warn("Dropping malformed message: {}", ex.getMessage());
            return;
        }

        try {
            if (isCritical(reading)) {
                raiseCriticalEvent(reading);
            }
            if (store(reading) && dualWrite) {
                writeToSecondary(reading);
            }
        } catch (RuntimeException ex) {
            log.error("Unexpected error while handling reading from {}: {}", reading.sensorId(), ex.getMessage(), ex);
        }
    }

    boolean isCritical(Reading reading) {
        return reading.temperature() > threshold;
    }

    private void raiseCriticalEvent(Reading reading) {
        metrics.recordCritical();
        log.warn("ALERT! Temperature for {} is above threshold {}: {}", reading.sensorId(), threshold, reading.temperature());
        try {
            criticalEventSink.append(CriticalEvent.of(reading));
        } catch (IOException ex) {
            log.error("Failed to record critical event for {} in {}: {}",
                    reading.sensorId(), criticalEventSink.file(), ex.getMessage());
        }
    }

    private boolean store(Reading reading) {
        open();
        try {
            readingStore.insert(connection, reading);
            metrics.recordStored();
            log.debug("Ingested reading for {}: {} at {}", reading.sensorId(), reading.temperature(), reading.timestamp());
            return true;
        } catch (PrimaryStoreException ex) {
            metrics.recordPrimaryFailure();
            log.error("Primary store error while ingesting reading for {}: {}. Reconnecting...",
                    reading.sensorId(), ex.getMessage());
            connection = readingStore.reconnect(connection);
            return false;
        }
    }

    private void writeToSecondary(Reading reading) {
        try {
            secondaryStore.upsert(ReadingDocument.from(reading));
        } catch (SecondaryStoreException ex) {
            metrics.recordSecondaryFailure();
            log.warn("Direct secondary store write failed for {}: {}", reading.sensorId(), ex.getMessage());
        }
    }
}
