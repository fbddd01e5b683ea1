package com.kotsin.breakout.feed;

import com.kotsin.breakout.model.OrderFlowSample;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Latest order-flow sample per symbol, waiting to ride along with that symbol's next bar.
 */
@Component
public class OrderFlowRegistry {

    private final Map<String, OrderFlowSample> latest = new ConcurrentHashMap<>();

    /**
     * Keeps the newer of the stored and the offered sample.
     */
    public void offer(OrderFlowSample sample) {
        latest.merge(sample.symbol(), sample, (old, neu) -> neu.time().isBefore(old.time()) ? old : neu);
    }

    /**
     * Removes and returns the pending sample, or null.
     */
    public OrderFlowSample take(String symbol) {
        return latest.remove(symbol);
    }
}
