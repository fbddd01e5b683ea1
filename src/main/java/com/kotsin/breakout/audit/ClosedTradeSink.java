package com.kotsin.breakout.audit;

import com.kotsin.breakout.position.ClosedTrade;

/**
 * Receives every closed trade after it is added to the session ledger.
 */
@FunctionalInterface
public interface ClosedTradeSink {

    void record(ClosedTrade trade);

    static ClosedTradeSink none() {
        return trade -> { };
    }
}
