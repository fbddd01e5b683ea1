package com.kotsin.breakout.position;

public enum OrderPurpose {
    ENTRY,
    PARTIAL,
    EXIT
}
