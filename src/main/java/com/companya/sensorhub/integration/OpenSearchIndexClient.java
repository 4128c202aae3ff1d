package com.companya.sensorhub.integration;

import com.companya.sensorhub.exception.SecondaryStoreException;
import com.companya.sensorhub.model.ReadingDocument;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Indexes reading documents into OpenSearch over its REST API.
 * Each write is a {@code PUT /{index}/_doc/{id}}, which overwrites on a repeated id.
 * Instances are created per caller in {@code SecondaryStoreConfig}.
 */
@Slf4j
public class OpenSearchIndexClient implements SecondaryStoreClient {

    public static final String INGEST = "ingest";
    public static final String REPLICATION = "replication";

    static final String CIRCUIT_BREAKER_PREFIX = "secondaryStore-";

    private final RestTemplate restTemplate;
    private final CircuitBreaker circuitBreaker;
    private final String index;

    /**
     * @param caller names this client's circuit breaker; each caller gets its own breaker
     */
    public OpenSearchIndexClient(RestTemplate restTemplate, CircuitBreakerRegistry cbRegistry,
                                 String index, String caller) {
        this.restTemplate = restTemplate;
        this.index = index;

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(50)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .build();
        this.circuitBreaker = cbRegistry.circuitBreaker(CIRCUIT_BREAKER_PREFIX + caller, cbConfig);
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public String index() {
        return index;
    }

    @Override
    public void upsert(ReadingDocument document) {
        String documentId = document.documentId();
        try {
            circuitBreaker.executeRunnable(() ->
                    restTemplate.put("/{index}/_doc/{id}", document, index, documentId));
            log.debug("Indexed document {} into {}", documentId, index);
        } catch (CallNotPermittedException ex) {
            throw new SecondaryStoreException("Secondary store circuit is open, document " + documentId + " not written", ex);
        } catch (HttpStatusCodeException ex) {
            throw new SecondaryStoreException("Secondary store rejected document " + documentId
                    + " with status " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            throw new SecondaryStoreException("Secondary store call failed for document " + documentId
                    + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void ping() {
        try {
            restTemplate.getForEntity("/", String.class);
        } catch (RestClientException ex) {
            throw new SecondaryStoreException("Secondary store is unreachable: " + ex.getMessage(), ex);
        }
    }
}
