package com.companya.sensorhub.jobs;

import com.companya.sensorhub.service.ReplicationCursorEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.replication.enabled", havingValue = "true", matchIfMissing = true)
public class ReplicationJob {

    private final ReplicationCursorEngine engine;
    private static final Logger log = LoggerFactory.getLogger(ReplicationJob.class);

    public ReplicationJob(ReplicationCursorEngine engine) {
        this.engine = engine;
    }

    // fixed delay: the next pass is scheduled only once this one returns
    @Scheduled(fixedDelayString = "${app.replication.poll-interval:PT15S}")
    public void run() {
        try {
            engine.runCycle();
        } catch (RuntimeException ex) {
            log.error("Replication cycle aborted: {}", ex.getMessage(), ex);
        }
    }
}
