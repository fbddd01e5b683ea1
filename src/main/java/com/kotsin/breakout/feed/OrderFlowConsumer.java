package com.kotsin.breakout.feed;

import com.kotsin.breakout.engine.DataException;
import com.kotsin.breakout.model.OrderFlowSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Live order-flow imbalance samples. Valid samples wait in the registry for the next bar.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OrderFlowConsumer {

    private final OrderFlowRegistry registry;

    @KafkaListener(
            topics = "${kafka.topics.order-flow:breakout.order-flow}",
            containerFactory = "orderFlowKafkaListenerContainerFactory"
    )
    public void consume(@Payload(required = false) OrderFlowSample sample, Acknowledgment acknowledgment) {
        try {
            if (sample == null) {
                return;
            }
            sample.validate();
            registry.offer(sample);
        } catch (DataException e) {
            log.warn("order_flow_rejected err={}", e.getMessage());
        } finally {
            acknowledgment.acknowledge();
        }
    }
}
