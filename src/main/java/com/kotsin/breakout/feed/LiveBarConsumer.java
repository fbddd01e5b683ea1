package com.kotsin.breakout.feed;

import com.kotsin.breakout.engine.BreakoutEngine;
import com.kotsin.breakout.engine.TickResult;
import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.model.MarketTick;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Live bars from the market-data normaliser. Each bar becomes one tick, carrying the latest
 * order-flow sample for its symbol if one arrived since the previous bar.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LiveBarConsumer {

    private final BreakoutEngine liveEngine;
    private final OrderFlowRegistry orderFlow;

    @KafkaListener(
            topics = "${kafka.topics.bars:breakout.bars}",
            containerFactory = "barKafkaListenerContainerFactory"
    )
    public void consume(@Payload(required = false) Bar bar, Acknowledgment acknowledgment) {
        if (bar == null) {
            acknowledgment.acknowledge();
            return;
        }
        // the engine rejects bad ticks itself and never throws for one symbol's data
        TickResult result = liveEngine.onTick(MarketTick.of(bar, orderFlow.take(bar.symbol())));
        if (result.isRejected()) {
            log.debug("Live bar rejected: symbol={} err={}", bar.symbol(), result.error());
        }
        acknowledgment.acknowledge();
    }
}
