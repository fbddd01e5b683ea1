package com.kotsin.breakout.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.breakout.engine.DataException;

import java.time.Instant;

/**
 * Order-flow imbalance for one interval.
 * imbalancePct is signed: positive = selling pressure, negative = buying pressure.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderFlowSample(
        String symbol,
        Instant time,
        double imbalancePct
) {

    public void validate() {
        if (symbol == null || symbol.isBlank()) {
            throw new DataException("Order-flow sample has no symbol");
        }
        if (time == null) {
            throw new DataException("Order-flow sample for " + symbol + " has no time");
        }
        if (!Double.isFinite(imbalancePct) || Math.abs(imbalancePct) > 100.0) {
            throw new DataException("Order-flow sample for " + symbol + " has invalid imbalance " + imbalancePct);
        }
    }

    /**
     * True when the sample shows pressure in the direction that supports {@code side}
     * (buying for LONG, selling for SHORT).
     */
    public boolean supports(Side side) {
        return side == Side.LONG ? imbalancePct < 0 : imbalancePct > 0;
    }

    public double magnitude() {
        return Math.abs(imbalancePct);
    }
}
