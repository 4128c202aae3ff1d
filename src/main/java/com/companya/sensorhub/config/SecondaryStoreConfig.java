package com.companya.sensorhub.config;

import com.companya.sensorhub.integration.OpenSearchIndexClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ssl.NoSuchSslBundleException;
import org.springframework.boot.ssl.SslBundle;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * One OpenSearch client per caller. Ingest and replication each get their own
 * {@link RestTemplate} and circuit breaker, so failures on one path never trip the other.
 */
@Configuration
public class SecondaryStoreConfig {

    public static final String INGEST_CLIENT = "ingestSecondaryStoreClient";
    public static final String REPLICATION_CLIENT = "replicationSecondaryStoreClient";

    private static final Logger logger = LoggerFactory.getLogger(SecondaryStoreConfig.class);

    @Bean(name = INGEST_CLIENT)
    public OpenSearchIndexClient ingestSecondaryStoreClient(RestTemplateBuilder builder,
                                                            SslBundles bundles,
                                                            CircuitBreakerRegistry cbRegistry,
                                                            SensorHubProperties properties) {
        return client(OpenSearchIndexClient.INGEST, builder, bundles, cbRegistry, properties);
    }

    @Bean(name = REPLICATION_CLIENT)
    public OpenSearchIndexClient replicationSecondaryStoreClient(RestTemplateBuilder builder,
                                                                 SslBundles bundles,
                                                                 CircuitBreakerRegistry cbRegistry,
                                                                 SensorHubProperties properties) {
        return client(OpenSearchIndexClient.REPLICATION, builder, bundles, cbRegistry, properties);
    }

    private OpenSearchIndexClient client(String caller,
                                         RestTemplateBuilder builder,
                                         SslBundles bundles,
                                         CircuitBreakerRegistry cbRegistry,
                                         SensorHubProperties properties) {
        SensorHubProperties.SecondaryStore store = properties.getSecondaryStore();
        logger.info("Initializing {} secondary store client for {} (index '{}')", caller, store.baseUrl(), store.getIndex());
        return new OpenSearchIndexClient(restTemplate(builder, bundles, store), cbRegistry, store.getIndex(), caller);
    }

    private RestTemplate restTemplate(RestTemplateBuilder builder, SslBundles bundles,
                                      SensorHubProperties.SecondaryStore store) {
        RestTemplateBuilder configured = builder
                .rootUri(store.baseUrl())
                .setConnectTimeout(store.getConnectTimeout())
                .setReadTimeout(store.getReadTimeout());
        if (store.getUsername() != null && !store.getUsername().isBlank()) {
            String password = store.getPassword() != null ? store.getPassword() : "";
            configured = configured.basicAuthentication(store.getUsername(), password);
        }
        if (!store.isUseSsl()) {
            return configured.build();
        }

        String bundleName = store.getSslBundle();
        if (bundleName == null || bundleName.isBlank()) {
            return configured.build();
        }
        try {
            SslBundle bundle = bundles.getBundle(bundleName);
            logger.info("SSL bundle '{}' found. Using it for the secondary store client.", bundleName);
            return configured.setSslBundle(bundle).build();
        } catch (NoSuchSslBundleException ex) {
            logger.warn("SSL bundle '{}' not found. Falling back to default JVM trust-store.", bundleName);
            return configured.build();
        }
    }
}
