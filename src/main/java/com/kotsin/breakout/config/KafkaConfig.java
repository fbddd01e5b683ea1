package com.kotsin.breakout.config;

import com.kotsin.breakout.broker.FillEvent;
import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.model.OrderFlowSample;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Consumer wiring for bars, order flow and fills. Values go through ErrorHandlingDeserializer so a
 * malformed record is logged and skipped instead of blocking the partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${app.kafka.consumer.bar-group-id}")
    private String barGroupId;

    @Value("${app.kafka.consumer.order-flow-group-id}")
    private String orderFlowGroupId;

    @Value("${app.kafka.consumer.fill-group-id}")
    private String fillGroupId;

    @Bean("barConsumerFactory")
    public ConsumerFactory<String, Bar> barConsumerFactory() {
        // bars must be replayed from the start of the session after a restart
        return new DefaultKafkaConsumerFactory<>(consumerProps(barGroupId, Bar.class, "earliest", 500));
    }

    @Bean("barKafkaListenerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, Bar> barKafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, Bar> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(barConsumerFactory());
        configure(factory);
        return factory;
    }

    @Bean("orderFlowConsumerFactory")
    public ConsumerFactory<String, OrderFlowSample> orderFlowConsumerFactory() {
        return new DefaultKafkaConsumerFactory<>(consumerProps(orderFlowGroupId, OrderFlowSample.class, "latest", 500));
    }

    @Bean("orderFlowKafkaListenerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, OrderFlowSample> orderFlowKafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, OrderFlowSample> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(orderFlowConsumerFactory());
        configure(factory);
        return factory;
    }

    @Bean("fillConsumerFactory")
    public ConsumerFactory<String, FillEvent> fillConsumerFactory() {
        return new DefaultKafkaConsumerFactory<>(consumerProps(fillGroupId, FillEvent.class, "earliest", 50));
    }

    @Bean("fillKafkaListenerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, FillEvent> fillKafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, FillEvent> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(fillConsumerFactory());
        configure(factory);
        return factory;
    }

    private Map<String, Object> consumerProps(String groupId, Class<?> valueType, String offsetReset, int maxPoll) {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);

        configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        configProps.put(ErrorHandlingDeserializer.KEY_DESERIALIZER_CLASS, StringDeserializer.class);
        configProps.put(ErrorHandlingDeserializer.VALUE_DESERIALIZER_CLASS, JsonDeserializer.class);

        configProps.put(JsonDeserializer.TRUSTED_PACKAGES, "*");
        configProps.put(JsonDeserializer.VALUE_DEFAULT_TYPE, valueType.getName());
        configProps.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);

        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, offsetReset);
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, maxPoll);
        configProps.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        configProps.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000);
        return configProps;
    }

    // Single consumer thread per topic: per-symbol bar order depends on it
    private void configure(ConcurrentKafkaListenerContainerFactory<String, ?> factory) {
        factory.setConcurrency(1);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(new FixedBackOff(1000L, 3L));
        errorHandler.addNotRetryableExceptions(DeserializationException.class, SerializationException.class);
        factory.setCommonErrorHandler(errorHandler);
    }
}
