package com.companya.sensorhub.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Counters for the ingest path, plus a periodic summary in the log.
 */
@Service
public class IngestMetrics {

    private static final Logger logger = LoggerFactory.getLogger(IngestMetrics.class);

    private final Counter receivedCounter;
    private final Counter storedCounter;
    private final Counter malformedCounter;
    private final Counter criticalCounter;
    private final Counter primaryFailureCounter;
    private final Counter secondaryFailureCounter;

    public IngestMetrics(MeterRegistry meterRegistry) {
        this.receivedCounter = Counter.builder("ingest.messages.received")
                .description("Messages delivered by the broker")
                .register(meterRegistry);
        this.storedCounter = Counter.builder("ingest.readings.stored")
                .description("Readings written to the primary store")
                .register(meterRegistry);
        this.malformedCounter = Counter.builder("ingest.messages.malformed")
                .description("Messages dropped because they could not be decoded")
                .register(meterRegistry);
        this.criticalCounter = Counter.builder("ingest.critical.events")
                .description("Readings above the temperature threshold")
                .register(meterRegistry);
        this.primaryFailureCounter = Counter.builder("ingest.primary.failures")
                .description("Readings lost to a primary store error")
                .register(meterRegistry);
        this.secondaryFailureCounter = Counter.builder("ingest.secondary.failures")
                .description("Direct secondary store writes that failed")
                .register(meterRegistry);
    }

    public void recordReceived() {
        receivedCounter.increment();
    }

    public void recordStored() {
        storedCounter.increment();
    }

    public void recordMalformed() {
        malformedCounter.increment();
    }

    public void recordCritical() {
        criticalCounter.increment();
    }

    public void recordPrimaryFailure() {
        primaryFailureCounter.increment();
    }

    public void recordSecondaryFailure() {
        secondaryFailureCounter.increment();
    }

    public long getReceivedCount() {
        return (long) receivedCounter.count();
    }

    public long getStoredCount() {
        return (long) storedCounter.count();
    }

    public long getMalformedCount() {
        return (long) malformedCounter.count();
    }

    public long getCriticalCount() {
        return (long) criticalCounter.count();
    }

    public long getPrimaryFailureCount() {
        return (long) primaryFailureCounter.count();
    }

    public long getSecondaryFailureCount() {
        return (long) secondaryFailureCounter.count();
    }

    /**
     * Runs every 5 minutes.
     */
    @Scheduled(fixedRate = 300000)
    public void logIngestStatistics() {
        if (getReceivedCount() == 0) {
            return;
        }
        logger.info("Ingest statistics - received: {}, stored: {}, malformed: {}, critical: {}, primary failures: {}, secondary failures: {}",
                getReceivedCount(), getStoredCount(), getMalformedCount(), getCriticalCount(),
                getPrimaryFailureCount(), getSecondaryFailureCount());
        if (getPrimaryFailureCount() > 0) {
            logger.warn("{} readings were lost to primary store errors since startup", getPrimaryFailureCount());
        }
    }
}
