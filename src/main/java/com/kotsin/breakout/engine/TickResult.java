package com.kotsin.breakout.engine;

import com.kotsin.breakout.entry.EntryDecision;
import com.kotsin.breakout.position.ExitAction;

/**
 * What one tick did. {@code error} is set when the tick was rejected.
 */
public record TickResult(
        String symbol,
        long logicalPosition,
        EntryDecision entry,
        ExitAction exit,
        String error
) {

    public static TickResult rejected(String symbol, String error) {
        return new TickResult(symbol, -1, null, null, error);
    }

    public boolean isRejected() {
        return error != null;
    }
}
