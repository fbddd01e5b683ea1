package com.kotsin.breakout.engine;

/**
 * Malformed or out-of-order market data. The tick is rejected and logged; the engine keeps running.
 */
public class DataException extends RuntimeException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
