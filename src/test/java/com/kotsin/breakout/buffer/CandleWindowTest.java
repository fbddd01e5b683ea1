package com.kotsin.breakout.buffer;

import com.kotsin.breakout.support.Bars;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CandleWindowTest {

    private BarBuffer filled(int capacity, int count) {
        BarBuffer buffer = new BarBuffer(capacity);
        for (int i = 0; i < count; i++) {
            buffer.append(Bars.at("MSFT", i, 5, 100 + i, 100.5 + i, 100));
        }
        return buffer;
    }

    @Test
    @DisplayName("Aggregates open of first bar, close of last, extremes and summed volume")
    void aggregate() {
        BarBuffer buffer = filled(16, 6);
        CandleWindow.Candle candle = CandleWindow.aggregate(buffer, 5, 3);

        assertEquals(3, candle.startPosition());
        assertEquals(103.0, candle.open());
        assertEquals(105.5, candle.close());
        assertEquals(105.5, candle.high());
        assertEquals(103.0, candle.low());
        assertEquals(300, candle.volume());
        assertEquals(3, candle.barCount());
    }

    @Test
    @DisplayName("A window reaching before the first bar or into evicted slots throws")
    void insufficientHistory() {
        assertThrows(EvictedRangeException.class, () -> CandleWindow.aggregate(filled(16, 2), 1, 3));
        assertThrows(EvictedRangeException.class, () -> CandleWindow.aggregate(filled(4, 10), 9, 5));
    }

    @Test
    @DisplayName("Average volume uses whatever history exists early in the session")
    void averageWithPartialHistory() {
        BarBuffer buffer = new BarBuffer(16);
        buffer.append(Bars.flat("MSFT", Bars.SESSION_OPEN, 100, 100));
        buffer.append(Bars.flat("MSFT", Bars.SESSION_OPEN.plusSeconds(5), 100, 300));
        buffer.append(Bars.flat("MSFT", Bars.SESSION_OPEN.plusSeconds(10), 100, 900));

        assertEquals(0.0, CandleWindow.averageBarVolume(buffer, 0, 10));
        assertEquals(200.0, CandleWindow.averageBarVolume(buffer, 2, 10));
        assertEquals(300.0, CandleWindow.averageBarVolume(buffer, 2, 1));
    }

    @Test
    @DisplayName("Volume ratio compares the window against the bars before it")
    void volumeRatio() {
        BarBuffer buffer = new BarBuffer(16);
        for (int i = 0; i < 4; i++) {
            buffer.append(Bars.flat("MSFT", Bars.SESSION_OPEN.plusSeconds(i * 5L), 100, 100));
        }
        buffer.append(Bars.flat("MSFT", Bars.SESSION_OPEN.plusSeconds(20), 100, 300));
        buffer.append(Bars.flat("MSFT", Bars.SESSION_OPEN.plusSeconds(25), 100, 300));

        CandleWindow.Candle candle = CandleWindow.aggregate(buffer, 5, 2);
        assertEquals(3.0, CandleWindow.volumeRatio(buffer, candle, 4), 1e-9);
    }
}
