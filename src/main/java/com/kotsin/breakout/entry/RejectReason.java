package com.kotsin.breakout.entry;

import java.util.Locale;

/**
 * Why an attempt did not turn into an order. The first group comes from the entry state machine,
 * the last three from the engine after the machine said ENTER.
 */
public enum RejectReason {
    THRESHOLD_NOT_MET,
    PRICE_REVERSAL,
    ATTEMPT_CAP_EXHAUSTED,
    OUTSIDE_ENTRY_WINDOW,
    POSITION_OPEN,
    PENDING_CLOSE,
    SYMBOL_HALTED,
    ENTRIES_DISABLED,
    STALE_BREAKOUT,
    INSUFFICIENT_HISTORY,
    INSUFFICIENT_ROOM,

    SIZING_REJECTED,
    EXPOSURE_LIMIT,
    BROKER_FAILURE;

    /**
     * Lower-case code used in logs and decision records, e.g. {@code price_reversal}.
     */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
