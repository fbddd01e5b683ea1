package com.kotsin.breakout.feed;

import com.kotsin.breakout.broker.FillEvent;
import com.kotsin.breakout.engine.BreakoutEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Execution reports from a live broker adapter.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FillEventConsumer {

    private final BreakoutEngine liveEngine;

    @KafkaListener(
            topics = "${kafka.topics.fills:breakout.fills}",
            containerFactory = "fillKafkaListenerContainerFactory"
    )
    public void consume(@Payload(required = false) FillEvent fill, Acknowledgment acknowledgment) {
        if (fill == null || fill.orderId() == null || fill.symbol() == null) {
            log.warn("Skipping malformed fill event: {}", fill);
            acknowledgment.acknowledge();
            return;
        }
        liveEngine.onFill(fill);
        acknowledgment.acknowledge();
    }
}
