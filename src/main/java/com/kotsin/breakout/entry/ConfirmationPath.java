package com.kotsin.breakout.entry;

/**
 * Which check fired the entry.
 */
public enum ConfirmationPath {
    // strong confirmation candle on its own
    MOMENTUM,
    // one order-flow sample past the aggressive threshold
    SINGLE_SAMPLE,
    // a run of order-flow samples past the sustained threshold
    SUSTAINED,
    // strong bar bouncing off a pullback towards the pivot
    PULLBACK_RETEST
}
