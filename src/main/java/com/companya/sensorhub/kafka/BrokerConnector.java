package com.companya.sensorhub.kafka;

import com.companya.sensorhub.exception.TransportConnectException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.apache.kafka.common.KafkaException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Checks that the broker answers before the listener is allowed to start.
 */
@Slf4j
@Component
public class BrokerConnector {

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(1);

    /**
     * @throws TransportConnectException if the cluster cannot be described within {@code timeout}
     */
    public BrokerConnection connect(String brokerAddress, Duration timeout) {
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        Map<String, Object> config = Map.of(
                AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, brokerAddress,
                AdminClientConfig.CLIENT_ID_CONFIG, "sensor-hub-connect-check",
                AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs,
                AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);

        log.info("Connecting to broker {}...", brokerAddress);
        Admin admin;
        try {
            admin = Admin.create(config);
        } catch (KafkaException ex) {
            throw new TransportConnectException("Invalid broker address " + brokerAddress + ": " + ex.getMessage(), ex);
        }

        try {
            DescribeClusterResult cluster = admin.describeCluster();
            String clusterId = cluster.clusterId().get(timeoutMs, TimeUnit.MILLISECONDS);
            int nodeCount = cluster.nodes().get(timeoutMs, TimeUnit.MILLISECONDS).size();
            log.info("Connected to broker {} (cluster {}, {} nodes)", brokerAddress, clusterId, nodeCount);
            return new BrokerConnection(brokerAddress, clusterId, nodeCount);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransportConnectException("Interrupted while connecting to broker " + brokerAddress, ex);
        } catch (ExecutionException | TimeoutException ex) {
            throw new TransportConnectException("Broker " + brokerAddress + " did not answer within "
                    + timeout.toSeconds() + "s", ex);
        } finally {
            admin.close(CLOSE_TIMEOUT);
        }
    }
}
