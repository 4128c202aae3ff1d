package com.companya.sensorhub.kafka;

import com.companya.sensorhub.service.IngestHandler;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "app.ingest.enabled", havingValue = "true", matchIfMissing = true)
public class SensorReadingListener {

    public static final String LISTENER_ID = "sensorReadingsListener";

    private final IngestHandler ingestHandler;
    private static final Logger log = LoggerFactory.getLogger(SensorReadingListener.class);

    public SensorReadingListener(IngestHandler ingestHandler) {
        this.ingestHandler = ingestHandler;
    }

    // Started by SensorReadingSubscriber once the broker and primary store are reachable.
    // Every record is acknowledged once handled; failed messages are not redelivered.
    @KafkaListener(id = LISTENER_ID, topics = "${app.transport.topic}", autoStartup = "false",
            containerFactory = "sensorReadingContainerFactory")
    public void consume(ConsumerRecord<String, byte[]> record, Acknowledgment ack) {
        log.debug("Received message partition={} offset={}", record.partition(), record.offset());
        try {
            ingestHandler.handle(record.value());
        } finally {
            ack.acknowledge();
        }
    }
}
