package com.companya.sensorhub.kafka;

/**
 * Outcome of a successful broker check.
 */
public record BrokerConnection(String brokerAddress, String clusterId, int nodeCount) {
}
