package com.companya.sensorhub.kafka;

import com.companya.sensorhub.config.SensorHubProperties;
import com.companya.sensorhub.exception.TransportConnectException;
import com.companya.sensorhub.service.IngestHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.listener.AbstractMessageListenerContainer;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Brings the ingest path up in order: primary store connection, broker check, then the listener.
 *
 * <p>A broker that cannot be reached within the connect timeout fails startup with a
 * {@link TransportConnectException}. Once running, broker disconnects are handled by the
 * Kafka client, which reconnects and resumes delivery on its own.</p>
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.ingest.enabled", havingValue = "true", matchIfMissing = true)
public class SensorReadingSubscriber implements SmartLifecycle {

    private final BrokerConnector brokerConnector;
    private final KafkaListenerEndpointRegistry registry;
    private final IngestHandler ingestHandler;
    private final String brokerAddress;
    private final String topic;
    private final Duration connectTimeout;

    private volatile boolean running;

    @Autowired
    public SensorReadingSubscriber(BrokerConnector brokerConnector,
                                   KafkaListenerEndpointRegistry registry,
                                   IngestHandler ingestHandler,
                                   KafkaProperties kafkaProperties,
                                   SensorHubProperties properties) {
        this(brokerConnector, registry, ingestHandler,
                String.join(",", kafkaProperties.getBootstrapServers()),
                properties.getTransport().getTopic(),
                properties.getTransport().getConnectTimeout());
    }

    public SensorReadingSubscriber(BrokerConnector brokerConnector,
                                   KafkaListenerEndpointRegistry registry,
                                   IngestHandler ingestHandler,
                                   String brokerAddress,
                                   String topic,
                                   Duration connectTimeout) {
        this.brokerConnector = brokerConnector;
        this.registry = registry;
        this.ingestHandler = ingestHandler;
        this.brokerAddress = brokerAddress;
        this.topic = topic;
        this.connectTimeout = connectTimeout;
    }

    @Override
    public void start() {
        ingestHandler.open();
        BrokerConnection connection = brokerConnector.connect(brokerAddress, connectTimeout);
        container().start();
        running = true;
        log.info("Subscribed to topic '{}' on {}", topic, connection.brokerAddress());
    }

    @Override
    public void stop() {
        MessageListenerContainer container = registry.getListenerContainer(SensorReadingListener.LISTENER_ID);
        if (container != null && container.isRunning()) {
            container.stop();
        }
        ingestHandler.close();
        running = false;
        log.info("Unsubscribed from topic '{}'", topic);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // after the listener registry, so the container exists when start() runs
    @Override
    public int getPhase() {
        return AbstractMessageListenerContainer.DEFAULT_PHASE + 50;
    }

    private MessageListenerContainer container() {
        MessageListenerContainer container = registry.getListenerContainer(SensorReadingListener.LISTENER_ID);
        if (container == null) {
            throw new IllegalStateException("Listener container '" + SensorReadingListener.LISTENER_ID + "' is not registered");
        }
        return container;
    }
}
