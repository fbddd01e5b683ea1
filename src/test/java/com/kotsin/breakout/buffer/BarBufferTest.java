package com.kotsin.breakout.buffer;

import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.support.Bars;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BarBufferTest {

    private static Bar bar(long i) {
        return Bars.flat("AAPL", Bars.SESSION_OPEN.plusSeconds(i * 5), 100 + i, 1000 + i);
    }

    @Test
    @DisplayName("Logical positions keep growing past the physical capacity")
    void positionsAreMonotonic() {
        BarBuffer buffer = new BarBuffer(4);
        assertEquals(-1, buffer.latest());
        assertTrue(buffer.isEmpty());

        for (long i = 0; i < 10; i++) {
            assertEquals(i, buffer.append(bar(i)));
        }
        assertEquals(9, buffer.latest());
        assertEquals(4, buffer.size());
        assertEquals(6, buffer.oldestRetained());
        assertEquals(109.0, buffer.get(9).close());
        assertEquals(106.0, buffer.get(6).close());
        assertEquals(1, buffer.slotIndex(9));
    }

    @Test
    @DisplayName("Reading an overwritten position raises EvictedRangeException")
    void evictedPositionThrows() {
        BarBuffer buffer = new BarBuffer(4);
        for (long i = 0; i < 6; i++) {
            buffer.append(bar(i));
        }
        EvictedRangeException e = assertThrows(EvictedRangeException.class, () -> buffer.get(1));
        assertEquals(1, e.getRequested());
        assertEquals(2, e.getOldestRetained());
        assertFalse(buffer.isRetained(1));
        assertTrue(buffer.isRetained(2));
    }

    @Test
    @DisplayName("Positions never appended are rejected")
    void futurePositionRejected() {
        BarBuffer buffer = new BarBuffer(4);
        buffer.append(bar(0));
        assertThrows(IllegalArgumentException.class, () -> buffer.get(1));
        assertThrows(IllegalArgumentException.class, () -> buffer.get(-1));
    }

    @Test
    @DisplayName("A resumed buffer continues numbering and holds nothing before the resume point")
    void resumeContinuesNumbering() {
        BarBuffer buffer = new BarBuffer(8);
        buffer.resumeAt(500);

        assertTrue(buffer.isEmpty());
        assertEquals(499, buffer.latest());
        assertEquals(500, buffer.append(bar(0)));
        assertEquals(1, buffer.size());
        assertFalse(buffer.isRetained(499));
        assertThrows(EvictedRangeException.class, () -> buffer.get(499));
        assertThrows(IllegalStateException.class, () -> buffer.resumeAt(900));
    }

    @Test
    @DisplayName("Capacity and null bars are validated")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new BarBuffer(0));
        assertThrows(IllegalArgumentException.class, () -> new BarBuffer(2).append(null));
    }
}
