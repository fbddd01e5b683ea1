package com.kotsin.breakout.buffer;

/**
 * Converts the confirmation window into raw bar counts for the current bar granularity.
 *
 * <p>All lookbacks that are configured in seconds or in confirmation candles go through
 * this class, so a change of bar interval rescales every one of them. Never cache the
 * derived bar counts elsewhere.
 */
public final class ConfirmationTiming {

    private final int barIntervalSeconds;
    private final int confirmationIntervalSeconds;
    private final int barsPerConfirmationInterval;

    private ConfirmationTiming(int barIntervalSeconds, int confirmationIntervalSeconds) {
        this.barIntervalSeconds = barIntervalSeconds;
        this.confirmationIntervalSeconds = confirmationIntervalSeconds;
        this.barsPerConfirmationInterval = confirmationIntervalSeconds / barIntervalSeconds;
    }

    public static ConfirmationTiming of(int barIntervalSeconds, int confirmationIntervalSeconds) {
        if (barIntervalSeconds <= 0 || confirmationIntervalSeconds <= 0) {
            throw new IllegalArgumentException("intervals must be > 0: bar=" + barIntervalSeconds
                    + "s confirmation=" + confirmationIntervalSeconds + "s");
        }
        if (confirmationIntervalSeconds % barIntervalSeconds != 0) {
            throw new IllegalArgumentException("confirmation interval " + confirmationIntervalSeconds
                    + "s is not a whole multiple of bar interval " + barIntervalSeconds + "s");
        }
        return new ConfirmationTiming(barIntervalSeconds, confirmationIntervalSeconds);
    }

    /**
     * Same confirmation window, new bar granularity.
     */
    public ConfirmationTiming withBarInterval(int newBarIntervalSeconds) {
        return of(newBarIntervalSeconds, confirmationIntervalSeconds);
    }

    public int barsPerConfirmationInterval() {
        return barsPerConfirmationInterval;
    }

    /**
     * Raw bars covering {@code seconds}, rounded up.
     */
    public long barsFor(int seconds) {
        return (seconds + barIntervalSeconds - 1) / barIntervalSeconds;
    }

    /**
     * Raw bars covering {@code candles} confirmation candles.
     */
    public long barsForCandles(int candles) {
        return (long) candles * barsPerConfirmationInterval;
    }

    public int barIntervalSeconds() {
        return barIntervalSeconds;
    }

    public int confirmationIntervalSeconds() {
        return confirmationIntervalSeconds;
    }

    @Override
    public String toString() {
        return "ConfirmationTiming{bar=" + barIntervalSeconds + "s, confirmation=" + confirmationIntervalSeconds
                + "s, barsPerInterval=" + barsPerConfirmationInterval + "}";
    }
}
