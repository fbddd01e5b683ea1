package com.kotsin.breakout.risk;

/**
 * Size could not be computed or failed validation. No order is placed.
 */
public class SizingException extends RuntimeException {

    public SizingException(String message) {
        super(message);
    }
}
