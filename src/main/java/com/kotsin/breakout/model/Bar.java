package com.kotsin.breakout.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.breakout.engine.DataException;

import java.time.Instant;

/**
 * One OHLCV bar for a symbol. Immutable once produced; ordering is by the
 * logical position assigned on append, never by wall clock alone.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Bar(
        String symbol,
        Instant openTime,
        double open,
        double high,
        double low,
        double close,
        long volume
) {

    /**
     * Reject malformed bars before they reach the buffer.
     */
    public void validate() {
        if (symbol == null || symbol.isBlank()) {
            throw new DataException("Bar has no symbol");
        }
        if (openTime == null) {
            throw new DataException("Bar for " + symbol + " has no open time");
        }
        if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low) || !Double.isFinite(close)) {
            throw new DataException("Bar for " + symbol + " at " + openTime + " has non-finite prices");
        }
        if (low <= 0 || high < low) {
            throw new DataException("Bar for " + symbol + " at " + openTime + " has invalid range low=" + low + " high=" + high);
        }
        if (open < low || open > high || close < low || close > high) {
            throw new DataException("Bar for " + symbol + " at " + openTime + " has open/close outside [low, high]");
        }
        if (volume < 0) {
            throw new DataException("Bar for " + symbol + " at " + openTime + " has negative volume " + volume);
        }
    }

    /**
     * Body size as a fraction of the open.
     */
    public double bodyPct() {
        return open > 0 ? Math.abs(close - open) / open : 0.0;
    }
}
