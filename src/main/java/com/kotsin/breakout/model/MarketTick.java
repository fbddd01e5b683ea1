package com.kotsin.breakout.model;

/**
 * What a driver pushes per symbol per tick interval: the new bar, the current price
 * and the order-flow sample if one arrived since the previous tick.
 */
public record MarketTick(
        Bar bar,
        double currentPrice,
        OrderFlowSample orderFlow
) {

    public static MarketTick of(Bar bar) {
        return new MarketTick(bar, bar.close(), null);
    }

    public static MarketTick of(Bar bar, OrderFlowSample orderFlow) {
        return new MarketTick(bar, bar.close(), orderFlow);
    }

    public String symbol() {
        return bar != null ? bar.symbol() : null;
    }
}
