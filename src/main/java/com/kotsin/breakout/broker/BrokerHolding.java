package com.kotsin.breakout.broker;

import com.kotsin.breakout.model.Side;

/**
 * A position as the broker reports it.
 */
public record BrokerHolding(String symbol, Side side, int shares, double averagePrice) {
}
