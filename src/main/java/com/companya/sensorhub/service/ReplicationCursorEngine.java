package com.companya.sensorhub.service;

import com.companya.sensorhub.config.SecondaryStoreConfig;
import com.companya.sensorhub.config.SensorHubProperties;
import com.companya.sensorhub.exception.PrimaryStoreException;
import com.companya.sensorhub.exception.SecondaryStoreException;
import com.companya.sensorhub.integration.SecondaryStoreClient;
import com.companya.sensorhub.model.Reading;
import com.companya.sensorhub.model.ReadingDocument;
import com.companya.sensorhub.model.ReadingFilter;
import com.companya.sensorhub.model.ReplicationState;
import com.companya.sensorhub.repository.CheckpointStore;
import com.companya.sensorhub.repository.ReadingStore;
import com.companya.sensorhub.repository.StoreConnection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Copies new primary-store rows into the secondary store, one pass per call to {@link #runCycle()}.
 *
 * <p>Each sensor's high-water mark bounds the next query. Marks move only once every
 * row of a pass has been written, so a failed pass is repeated in full on the next call.
 * Document keys are deterministic, which makes the repeat harmless.</p>
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.replication.enabled", havingValue = "true", matchIfMissing = true)
public class ReplicationCursorEngine {

    private final ReadingStore readingStore;
    private final CheckpointStore checkpointStore;
    private final SecondaryStoreClient secondaryStore;
    private final boolean checkpointsEnabled;
    private final Counter documentsWritten;
    private final Counter cyclesFailed;

    private final HighWaterMarks marks = new HighWaterMarks();
    private final ReentrantLock cycleLock = new ReentrantLock();

    private StoreConnection connection;
    private boolean connectionStale;
    private boolean checkpointsRestored;

    @Autowired
    public ReplicationCursorEngine(ReadingStore readingStore,
                                   CheckpointStore checkpointStore,
                                   @Qualifier(SecondaryStoreConfig.REPLICATION_CLIENT) SecondaryStoreClient secondaryStore,
                                   MeterRegistry meterRegistry,
                                   SensorHubProperties properties) {
        this(readingStore, checkpointStore, secondaryStore, meterRegistry,
                properties.getReplication().getCheckpoint().isEnabled());
    }

    public ReplicationCursorEngine(ReadingStore readingStore,
                                   CheckpointStore checkpointStore,
                                   SecondaryStoreClient secondaryStore,
                                   MeterRegistry meterRegistry,
                                   boolean checkpointsEnabled) {
        this.readingStore = readingStore;
        this.checkpointStore = checkpointStore;
        this.secondaryStore = secondaryStore;
        this.checkpointsEnabled = checkpointsEnabled;
        this.documentsWritten = Counter.builder("replication.documents.written")
                .description("Documents written to the secondary store by replication")
                .register(meterRegistry);
        this.cyclesFailed = Counter.builder("replication.cycles.failed")
                .description("Replication passes that ended without moving marks")
                .register(meterRegistry);
    }

    /**
     * Runs one pass. Returns immediately with {@link CycleResult.Outcome#SKIPPED} if another pass is in flight.
     */
    public CycleResult runCycle() {
        if (!cycleLock.tryLock()) {
            log.warn("Previous replication cycle still running, skipping this tick");
            return CycleResult.skipped(marks.state());
        }
        try {
            CycleResult result = replicate();
            logResult(result);
            return result;
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleResult replicate() {
        ensureConnection();
        ReplicationState state;
        List<Reading> rows;
        try {
            restoreCheckpoints();
            state = marks.state();
            ReadingFilter filter = marks.toFilter();
            rows = readingStore.query(connection, filter);
        } catch (PrimaryStoreException ex) {
            cyclesFailed.increment();
            connectionStale = true;
            log.error("Replication query failed: {}. Will reconnect on next cycle", ex.getMessage());
            return CycleResult.queryFailed(marks.state());
        }

        if (rows.isEmpty()) {
            return new CycleResult(state, CycleResult.Outcome.NO_NEW_ROWS, 0, 0);
        }

        Map<String, Instant> newest = new HashMap<>();
        int written = 0;
        for (Reading row : rows) {
            try {
                secondaryStore.upsert(ReadingDocument.from(row));
            } catch (SecondaryStoreException ex) {
                cyclesFailed.increment();
                log.error("Secondary store write failed after {} of {} rows: {}. Marks unchanged, cycle will be retried",
                        written, rows.size(), ex.getMessage());
                return new CycleResult(state, CycleResult.Outcome.WRITE_FAILED, rows.size(), written);
            }
            written++;
            documentsWritten.increment();
            newest.merge(row.sensorId(), row.timestamp(), (a, b) -> b.isAfter(a) ? b : a);
        }

        marks.advance(newest);
        saveCheckpoints();
        return new CycleResult(state, CycleResult.Outcome.REPLICATED, rows.size(), written);
    }

    private void ensureConnection() {
        if (connection == null) {
            connection = readingStore.connect();
        } else if (connectionStale || !connection.isOpen()) {
            connection = readingStore.reconnect(connection);
        }
        connectionStale = false;
    }

    private void restoreCheckpoints() {
        if (!checkpointsEnabled || checkpointsRestored) {
            return;
        }
        checkpointStore.ensureSchema(connection);
        Map<String, Instant> saved = checkpointStore.load(connection);
        marks.advance(saved);
        checkpointsRestored = true;
        log.info("Restored {} replication checkpoints", saved.size());
    }

    private void saveCheckpoints() {
        if (!checkpointsEnabled) {
            return;
        }
        try {
            checkpointStore.save(connection, marks.snapshot());
        } catch (PrimaryStoreException ex) {
            connectionStale = true;
            log.warn("Could not save replication checkpoints: {}", ex.getMessage());
        }
    }

    private void logResult(CycleResult result) {
        switch (result.outcome()) {
            case REPLICATED -> log.info("Replicated {} rows ({} state), tracking {} sensors",
                    result.documentsWritten(), result.state(), marks.size());
            case NO_NEW_ROWS -> log.debug("No new rows to replicate");
            default -> log.debug("Replication cycle ended with {}", result.outcome());
        }
    }

    Map<String, Instant> currentMarks() {
        return marks.snapshot();
    }

    /**
     * Waits for an in-flight cycle to finish, then releases the connection.
     */
    @PreDestroy
    public void close() {
        cycleLock.lock();
        try {
            if (connection != null) {
                connection.close();
                connection = null;
            }
        } finally {
            cycleLock.unlock();
        }
    }
}
