package com.kotsin.breakout.buffer;

/**
 * Aggregates consecutive raw bars into one candle using logical-position arithmetic only.
 *
 * <p>A window covering {@code [end - bars + 1, end]} must be fully retained; any evicted
 * position raises {@link EvictedRangeException} rather than returning a partial candle.
 */
public final class CandleWindow {

    private CandleWindow() {
    }

    /**
     * Aggregated candle over a closed range of logical positions.
     */
    public record Candle(long startPosition, long endPosition,
                         double open, double high, double low, double close, long volume) {

        public double bodyPct() {
            return open > 0 ? Math.abs(close - open) / open : 0.0;
        }

        public int barCount() {
            return (int) (endPosition - startPosition + 1);
        }
    }

    public static Candle aggregate(BarBuffer buffer, long endPosition, int bars) {
        if (bars <= 0) {
            throw new IllegalArgumentException("bars must be > 0, got " + bars);
        }
        long start = endPosition - bars + 1;
        if (start < 0) {
            throw new EvictedRangeException(start, buffer.oldestRetained());
        }
        var first = buffer.get(start);
        double high = first.high();
        double low = first.low();
        double close = first.close();
        long volume = first.volume();
        for (long p = start + 1; p <= endPosition; p++) {
            var bar = buffer.get(p);
            high = Math.max(high, bar.high());
            low = Math.min(low, bar.low());
            close = bar.close();
            volume += bar.volume();
        }
        return new Candle(start, endPosition, first.open(), high, low, close, volume);
    }

    /**
     * Mean raw-bar volume over up to {@code bars} positions strictly before {@code beforePosition}.
     * Near the start of a session fewer bars exist; the mean then covers what has been appended.
     * Returns 0 when nothing precedes the position.
     *
     * @throws EvictedRangeException when part of that range has been overwritten
     */
    public static double averageBarVolume(BarBuffer buffer, long beforePosition, long bars) {
        if (bars <= 0) {
            throw new IllegalArgumentException("bars must be > 0, got " + bars);
        }
        long start = Math.max(buffer.firstPosition(), beforePosition - bars);
        if (start >= beforePosition) {
            return 0.0;
        }
        if (!buffer.isRetained(start)) {
            throw new EvictedRangeException(start, buffer.oldestRetained());
        }
        long total = 0;
        for (long p = start; p < beforePosition; p++) {
            total += buffer.get(p).volume();
        }
        return (double) total / (beforePosition - start);
    }

    /**
     * Window volume divided by the average volume of the same number of bars before it.
     * Returns 0 when the history has no volume at all.
     */
    public static double volumeRatio(BarBuffer buffer, Candle candle, long lookbackBars) {
        double avgPerBar = averageBarVolume(buffer, candle.startPosition(), lookbackBars);
        if (avgPerBar <= 0) {
            return 0.0;
        }
        return candle.volume() / (avgPerBar * candle.barCount());
    }
}
