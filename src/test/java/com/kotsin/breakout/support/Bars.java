package com.kotsin.breakout.support;

import com.kotsin.breakout.model.Bar;

import java.time.Instant;

/**
 * Bar builders shared by the tests.
 */
public final class Bars {

    public static final Instant SESSION_OPEN = Instant.parse("2024-03-15T13:30:00Z");

    private Bars() {
    }

    public static Bar flat(String symbol, Instant openTime, double price, long volume) {
        return new Bar(symbol, openTime, price, price, price, price, volume);
    }

    public static Bar of(String symbol, Instant openTime, double open, double close, long volume) {
        return new Bar(symbol, openTime, open, Math.max(open, close), Math.min(open, close), close, volume);
    }

    public static Bar at(String symbol, long index, int intervalSeconds, double open, double close, long volume) {
        return of(symbol, SESSION_OPEN.plusSeconds(index * intervalSeconds), open, close, volume);
    }
}
