package com.kotsin.breakout.buffer;

/**
 * A lookback referenced a logical position that has already been overwritten in the ring.
 * Callers treat this as insufficient history, never approximate.
 */
public class EvictedRangeException extends RuntimeException {

    private final long requested;
    private final long oldestRetained;

    public EvictedRangeException(long requested, long oldestRetained) {
        super("Logical position " + requested + " evicted (oldest retained " + oldestRetained + ")");
        this.requested = requested;
        this.oldestRetained = oldestRetained;
    }

    public long getRequested() {
        return requested;
    }

    public long getOldestRetained() {
        return oldestRetained;
    }
}
