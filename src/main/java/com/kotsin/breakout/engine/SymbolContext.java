package com.kotsin.breakout.engine;

import com.kotsin.breakout.buffer.BarBuffer;
import com.kotsin.breakout.entry.EntryStateMachine;
import com.kotsin.breakout.model.PivotLevel;
import com.kotsin.breakout.state.StateTracker;

import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Everything the engine keeps for one watched symbol. All access goes through {@link #lock()}.
 * The lock is reentrant because a synchronous broker delivers fills while a tick holds it.
 */
public class SymbolContext {

    private final PivotLevel pivot;
    private final BarBuffer buffer;
    private final StateTracker tracker;
    private final EntryStateMachine machine;
    private final ReentrantLock lock = new ReentrantLock();
    // written under the lock, read without it by the snapshot
    private volatile Instant lastOpenTime;
    private volatile long lastLogicalPosition = -1;

    public SymbolContext(PivotLevel pivot, BarBuffer buffer, StateTracker tracker, EntryStateMachine machine) {
        this.pivot = pivot;
        this.buffer = buffer;
        this.tracker = tracker;
        this.machine = machine;
    }

    public String symbol() {
        return pivot.getSymbol();
    }

    public PivotLevel pivot() {
        return pivot;
    }

    public BarBuffer buffer() {
        return buffer;
    }

    public StateTracker tracker() {
        return tracker;
    }

    public EntryStateMachine machine() {
        return machine;
    }

    public ReentrantLock lock() {
        return lock;
    }

    public Instant lastOpenTime() {
        return lastOpenTime;
    }

    /**
     * Logical position of the last accepted bar, or -1 before the first one.
     */
    public long lastLogicalPosition() {
        return lastLogicalPosition;
    }

    void setLastOpenTime(Instant lastOpenTime) {
        this.lastOpenTime = lastOpenTime;
    }

    void setLastLogicalPosition(long lastLogicalPosition) {
        this.lastLogicalPosition = lastLogicalPosition;
    }

    void accepted(Instant openTime, long logicalPosition) {
        this.lastOpenTime = openTime;
        this.lastLogicalPosition = logicalPosition;
    }
}
