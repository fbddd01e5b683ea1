package com.kotsin.breakout.broker;

/**
 * Any error while talking to the broker. Transient errors (timeouts, throttling, lost
 * connections) are retried by {@link BrokerGateway}; the rest fail immediately.
 */
public class BrokerException extends RuntimeException {

    private final boolean transientFailure;

    public BrokerException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public BrokerException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public static BrokerException transientFailure(String message) {
        return new BrokerException(message, true);
    }

    public static BrokerException permanent(String message) {
        return new BrokerException(message, false);
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
