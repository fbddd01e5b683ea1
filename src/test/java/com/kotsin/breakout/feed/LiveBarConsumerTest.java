package com.kotsin.breakout.feed;

import com.kotsin.breakout.engine.BreakoutEngine;
import com.kotsin.breakout.engine.TickResult;
import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.model.MarketTick;
import com.kotsin.breakout.model.OrderFlowSample;
import com.kotsin.breakout.support.Bars;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LiveBarConsumerTest {

    @Mock
    private BreakoutEngine engine;
    @Mock
    private Acknowledgment acknowledgment;

    @Test
    @DisplayName("A live bar picks up the pending order-flow sample for its symbol and is acknowledged")
    void barCarriesPendingSample() {
        OrderFlowRegistry registry = new OrderFlowRegistry();
        LiveBarConsumer consumer = new LiveBarConsumer(engine, registry);
        Bar bar = Bars.flat("AAPL", Bars.SESSION_OPEN, 100, 500);
        OrderFlowSample sample = new OrderFlowSample("AAPL", Bars.SESSION_OPEN.plusSeconds(2), -22);
        registry.offer(sample);
        when(engine.onTick(any())).thenReturn(new TickResult("AAPL", 0, null, null, null));

        consumer.consume(bar, acknowledgment);

        ArgumentCaptor<MarketTick> tick = ArgumentCaptor.forClass(MarketTick.class);
        verify(engine).onTick(tick.capture());
        assertSame(sample, tick.getValue().orderFlow());
        assertNull(registry.take("AAPL"));
        verify(acknowledgment).acknowledge();
    }

    @Test
    @DisplayName("Tombstones are acknowledged without reaching the engine")
    void nullPayload() {
        new LiveBarConsumer(engine, new OrderFlowRegistry()).consume(null, acknowledgment);
        verifyNoInteractions(engine);
        verify(acknowledgment).acknowledge();
    }
}
