package com.kotsin.breakout.entry;

public enum EntryAction {
    ENTER,
    WAIT,
    REJECT
}
