package com.kotsin.breakout.entry;

/**
 * CONFIRMED is never held: the machine reports ENTER and goes straight back to IDLE.
 */
public enum EntryState {
    IDLE,
    WATCHING_BREAKOUT,
    AWAITING_CONFIRMATION
}
