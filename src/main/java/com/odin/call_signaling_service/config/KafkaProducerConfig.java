package com.odin.call_signaling_service.config;

import com.odin.call_signaling_service.dto.NotificationMessage;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for call push notifications. Bounded blocking and delivery
 * time, since a late ring notification is worthless.
 */
@Slf4j
@Configuration
public class KafkaProducerConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.producer.acks:all}")
    private String acks;

    @Value("${spring.kafka.producer.retries:3}")
    private int retries;

    @Value("${spring.kafka.producer.linger-ms:0}")
    private int lingerMs;

    @Value("${kafka.notification.topic:notification-events}")
    private String notificationTopic;

    // send() runs on a device event loop; it must not stall there on a missing broker
    @Value("${kafka.notification.max-block-ms:2000}")
    private long maxBlockMs;

    // a push that arrives after the caller gave up is useless
    @Value("${kafka.notification.delivery-timeout-ms:30000}")
    private int deliveryTimeoutMs;

    @Value("${kafka.notification.request-timeout-ms:10000}")
    private int requestTimeoutMs;

    @Bean
    public ProducerFactory<String, NotificationMessage> producerFactory() {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        configProps.put(ProducerConfig.ACKS_CONFIG, acks);
        configProps.put(ProducerConfig.RETRIES_CONFIG, retries);
        configProps.put(ProducerConfig.LINGER_MS_CONFIG, lingerMs);
        configProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);
        configProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, requestTimeoutMs);
        configProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG,
                Math.max(deliveryTimeoutMs, requestTimeoutMs + lingerMs));
        configProps.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        log.info("Initializing call notification ProducerFactory with bootstrapServers={}, acks={}, "
                + "maxBlockMs={}, deliveryTimeoutMs={}",
                bootstrapServers, acks, maxBlockMs, deliveryTimeoutMs);

        return new DefaultKafkaProducerFactory<>(configProps);
    }

    @Bean
    public KafkaTemplate<String, NotificationMessage> kafkaTemplate() {
        KafkaTemplate<String, NotificationMessage> template = new KafkaTemplate<>(producerFactory());
        template.setDefaultTopic(notificationTopic);
        log.info("KafkaTemplate configured with default topic: {}", notificationTopic);
        return template;
    }
}
