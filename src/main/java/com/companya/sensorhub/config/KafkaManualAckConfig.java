package com.companya.sensorhub.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.kafka.ConcurrentKafkaListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.util.backoff.FixedBackOff;

@Slf4j
@Configuration
public class KafkaManualAckConfig {

    /**
     * Single consumer thread with manual acknowledgement. A record whose listener throws
     * is logged and skipped, never redelivered.
     */
    @Bean(name = "sensorReadingContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, byte[]> sensorReadingContainerFactory(
            ConcurrentKafkaListenerContainerFactoryConfigurer configurer,
            ConsumerFactory<Object, Object> consumerFactory) {
        ConcurrentKafkaListenerContainerFactory<Object, Object> genericFactory =
                new ConcurrentKafkaListenerContainerFactory<>();
        configurer.configure(genericFactory, consumerFactory);
        genericFactory.setConcurrency(1);
        genericFactory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(
                (record, ex) -> log.error("Skipping record {}-{}@{}: {}",
                        record.topic(), record.partition(), record.offset(), ex.getMessage()),
                new FixedBackOff(0L, 0L));
        errorHandler.setCommitRecovered(true);
        genericFactory.setCommonErrorHandler(errorHandler);
        @SuppressWarnings("unchecked")
        ConcurrentKafkaListenerContainerFactory<String, byte[]> typedFactory =
                (ConcurrentKafkaListenerContainerFactory<String, byte[]>) (ConcurrentKafkaListenerContainerFactory<?, ?>) genericFactory;
        return typedFactory;
    }
}
