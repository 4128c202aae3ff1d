package com.companya.sensorhub.integration;

import com.companya.sensorhub.exception.SecondaryStoreException;
import com.companya.sensorhub.model.Reading;
import com.companya.sensorhub.model.ReadingDocument;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withBadRequest;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("OpenSearchIndexClient Tests")
class OpenSearchIndexClientTest {

    private static final String BASE = "http://search.local:9200";
    private static final String DOC_URL = BASE + "/sensor_readings/_doc/id_1_2024-01-01T00:00:00";

    private CircuitBreakerRegistry cbRegistry;
    private MockRestServiceServer server;
    private OpenSearchIndexClient client;
    private MockRestServiceServer ingestServer;
    private OpenSearchIndexClient ingestClient;

    private final ReadingDocument document = ReadingDocument.from(
            new Reading("id_1", Instant.parse("2024-01-01T00:00:00Z"), 30.0));

    @BeforeEach
    void setUp() {
        cbRegistry = CircuitBreakerRegistry.ofDefaults();

        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(BASE).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new OpenSearchIndexClient(restTemplate, cbRegistry, "sensor_readings", OpenSearchIndexClient.REPLICATION);

        RestTemplate ingestTemplate = new RestTemplateBuilder().rootUri(BASE).build();
        ingestServer = MockRestServiceServer.bindTo(ingestTemplate).build();
        ingestClient = new OpenSearchIndexClient(ingestTemplate, cbRegistry, "sensor_readings", OpenSearchIndexClient.INGEST);
    }

    @Nested
    @DisplayName("Upsert")
    class Upsert {

        @Test
        @DisplayName("Puts the document under its deterministic id")
        void putsDocument() {
            server.expect(requestTo(DOC_URL))
                    .andExpect(method(HttpMethod.PUT))
                    .andExpect(content().json("{\"id\":\"id_1\",\"timestamp\":\"2024-01-01T00:00:00Z\",\"temperature\":30.0}", true))
                    .andRespond(withStatus(HttpStatus.CREATED)
                            .contentType(MediaType.APPLICATION_JSON)
                            .body("{\"result\":\"created\"}"));

            client.upsert(document);

            server.verify();
        }

        @Test
        void serverErrorBecomesStoreError() {
            server.expect(requestTo(DOC_URL)).andRespond(withServerError());

            assertThatThrownBy(() -> client.upsert(document))
                    .isInstanceOf(SecondaryStoreException.class)
                    .hasMessageContaining("500");
        }

        @Test
        void rejectedDocumentBecomesStoreError() {
            server.expect(requestTo(DOC_URL)).andRespond(withBadRequest());

            assertThatThrownBy(() -> client.upsert(document))
                    .isInstanceOf(SecondaryStoreException.class)
                    .hasMessageContaining("400");
        }

        @Test
        @DisplayName("Repeated failures open the circuit and later calls fail fast")
        void circuitOpensAfterRepeatedFailures() {
            server.expect(ExpectedCount.times(5), requestTo(DOC_URL)).andRespond(withServerError());

            for (int i = 0; i < 5; i++) {
                assertThatThrownBy(() -> client.upsert(document)).isInstanceOf(SecondaryStoreException.class);
            }

            assertThat(client.getCircuitBreaker().getState()).isEqualTo(CircuitBreaker.State.OPEN);
            assertThatThrownBy(() -> client.upsert(document))
                    .isInstanceOf(SecondaryStoreException.class)
                    .hasCauseInstanceOf(CallNotPermittedException.class);
            server.verify();
        }
    }

    @Nested
    @DisplayName("Per-caller isolation")
    class PerCallerIsolation {

        @Test
        void eachCallerHasItsOwnBreaker() {
            assertThat(ingestClient.getCircuitBreaker()).isNotSameAs(client.getCircuitBreaker());
            assertThat(ingestClient.getCircuitBreaker().getName()).isEqualTo("secondaryStore-ingest");
            assertThat(client.getCircuitBreaker().getName()).isEqualTo("secondaryStore-replication");
        }

        @Test
        @DisplayName("Failing ingest writes do not stop replication writes to a healthy store")
        void ingestFailuresLeaveReplicationUnaffected() {
            ingestServer.expect(ExpectedCount.times(5), requestTo(DOC_URL)).andRespond(withServerError());
            server.expect(requestTo(DOC_URL))
                    .andExpect(method(HttpMethod.PUT))
                    .andRespond(withSuccess("{\"result\":\"updated\"}", MediaType.APPLICATION_JSON));

            for (int i = 0; i < 5; i++) {
                assertThatThrownBy(() -> ingestClient.upsert(document)).isInstanceOf(SecondaryStoreException.class);
            }
            client.upsert(document);

            assertThat(ingestClient.getCircuitBreaker().getState()).isEqualTo(CircuitBreaker.State.OPEN);
            assertThat(client.getCircuitBreaker().getState()).isEqualTo(CircuitBreaker.State.CLOSED);
            ingestServer.verify();
            server.verify();
        }
    }

    @Nested
    @DisplayName("Health")
    class HealthCheck {

        @Test
        void upWhenClusterAnswers() {
            server.expect(requestTo(BASE + "/"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("{\"cluster_name\":\"test\"}", MediaType.APPLICATION_JSON));

            Health health = new SecondaryStoreHealthIndicator(ingestClient, client).health();

            assertThat(health.getStatus()).isEqualTo(Status.UP);
            assertThat(health.getDetails())
                    .containsEntry("index", "sensor_readings")
                    .containsEntry("ingestCircuitBreaker", "CLOSED")
                    .containsEntry("replicationCircuitBreaker", "CLOSED");
        }

        @Test
        void downWhenClusterFails() {
            server.expect(requestTo(BASE + "/")).andRespond(withServerError());

            Health health = new SecondaryStoreHealthIndicator(ingestClient, client).health();

            assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        }
    }
}
