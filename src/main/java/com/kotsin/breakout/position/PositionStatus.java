package com.kotsin.breakout.position;

public enum PositionStatus {
    OPEN,
    // a full exit order is out and not yet filled
    PENDING_CLOSE,
    // the broker rejected a protective action; the symbol is halted until an operator steps in
    BROKER_ERROR
}
