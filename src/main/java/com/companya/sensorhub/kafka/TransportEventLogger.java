package com.companya.sensorhub.kafka;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.event.ConsumerFailedToStartEvent;
import org.springframework.kafka.event.ConsumerStartedEvent;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;
import org.springframework.stereotype.Component;

/**
 * Logs consumer state transitions published by the listener container.
 */
@Slf4j
@Component
public class TransportEventLogger {

    @EventListener
    public void onStarted(ConsumerStartedEvent event) {
        log.info("Broker consumer started: {}", event.getSource());
    }

    @EventListener
    public void onStopped(ConsumerStoppedEvent event) {
        log.info("Broker consumer stopped: {}", event.getReason());
    }

    @EventListener
    public void onFailedToStart(ConsumerFailedToStartEvent event) {
        log.error("Broker consumer failed to start: {}", event.getSource());
    }

    @EventListener
    public void onNonResponsive(NonResponsiveConsumerEvent event) {
        log.warn("Broker consumer unresponsive for {} ms, waiting for the client to reconnect",
                event.getTimeSinceLastPoll());
    }
}
