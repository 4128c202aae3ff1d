package com.companya.sensorhub.integration;

import com.companya.sensorhub.config.SecondaryStoreConfig;
import com.companya.sensorhub.exception.SecondaryStoreException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("secondaryStore")
public class SecondaryStoreHealthIndicator implements HealthIndicator {

    private final OpenSearchIndexClient ingestClient;
    private final OpenSearchIndexClient replicationClient;

    public SecondaryStoreHealthIndicator(@Qualifier(SecondaryStoreConfig.INGEST_CLIENT) OpenSearchIndexClient ingestClient,
                                         @Qualifier(SecondaryStoreConfig.REPLICATION_CLIENT) OpenSearchIndexClient replicationClient) {
        this.ingestClient = ingestClient;
        this.replicationClient = replicationClient;
    }

    @Override
    public Health health() {
        try {
            replicationClient.ping();
            return Health.up()
                    .withDetail("index", replicationClient.index())
                    .withDetail("ingestCircuitBreaker", ingestClient.getCircuitBreaker().getState().name())
                    .withDetail("replicationCircuitBreaker", replicationClient.getCircuitBreaker().getState().name())
                    .build();
        } catch (SecondaryStoreException ex) {
            return Health.down(ex)
                    .withDetail("index", replicationClient.index())
                    .build();
        }
    }
}
