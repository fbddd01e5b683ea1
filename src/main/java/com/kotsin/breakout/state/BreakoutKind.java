package com.kotsin.breakout.state;

public enum BreakoutKind {
    STRONG,
    WEAK,
    // re-cross after a STRONG break that came back toward the pivot
    PULLBACK
}
