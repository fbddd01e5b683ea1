package com.kotsin.breakout.buffer;

import com.kotsin.breakout.model.Bar;

/**
 * Bounded ring of bars for one symbol.
 *
 * <p>Each appended bar gets the next logical position (0, 1, 2, ...). The physical slot is
 * {@code logicalPosition % capacity}, so positions keep growing for the whole session while
 * storage stays fixed. A position is readable only while
 * {@code latest() - position < capacity}; older positions raise {@link EvictedRangeException}.
 *
 * <p>Not thread-safe. The owning symbol context serialises access.
 */
public class BarBuffer {

    private final Bar[] slots;
    private final int capacity;
    private long latest = -1;
    // positions below this were assigned by an earlier process and are not held here
    private long firstPosition;

    public BarBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.capacity = capacity;
        this.slots = new Bar[capacity];
    }

    /**
     * Continues numbering from {@code nextPosition}, used when a session resumes after a restart.
     * Only allowed while empty.
     */
    public void resumeAt(long nextPosition) {
        if (!isEmpty()) {
            throw new IllegalStateException("resumeAt on a non-empty buffer (latest " + latest + ")");
        }
        if (nextPosition < 0) {
            throw new IllegalArgumentException("nextPosition must be >= 0, got " + nextPosition);
        }
        firstPosition = nextPosition;
        latest = nextPosition - 1;
    }

    /**
     * Stores the bar and returns its logical position.
     */
    public long append(Bar bar) {
        if (bar == null) {
            throw new IllegalArgumentException("bar must not be null");
        }
        long position = latest + 1;
        slots[slotIndex(position)] = bar;
        latest = position;
        return position;
    }

    /**
     * Returns the bar stored at {@code logicalPosition}.
     *
     * @throws EvictedRangeException    if the position has been overwritten
     * @throws IllegalArgumentException if the position was never appended
     */
    public Bar get(long logicalPosition) {
        if (logicalPosition < 0 || logicalPosition > latest) {
            throw new IllegalArgumentException("Logical position " + logicalPosition
                    + " not appended yet (latest " + latest + ")");
        }
        if (!isRetained(logicalPosition)) {
            throw new EvictedRangeException(logicalPosition, oldestRetained());
        }
        return slots[slotIndex(logicalPosition)];
    }

    /**
     * Latest assigned logical position, -1 while a fresh buffer is empty.
     */
    public long latest() {
        return latest;
    }

    public boolean isRetained(long logicalPosition) {
        return logicalPosition >= firstPosition && logicalPosition <= latest && latest - logicalPosition < capacity;
    }

    public long oldestRetained() {
        return Math.max(firstPosition, latest - capacity + 1);
    }

    public int size() {
        return (int) Math.min(latest + 1 - firstPosition, capacity);
    }

    /**
     * First position this buffer has ever held; 0 unless the session was resumed.
     */
    public long firstPosition() {
        return firstPosition;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return latest < firstPosition;
    }

    int slotIndex(long logicalPosition) {
        return (int) (logicalPosition % capacity);
    }
}
