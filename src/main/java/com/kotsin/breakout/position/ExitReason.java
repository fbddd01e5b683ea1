package com.kotsin.breakout.position;

public enum ExitReason {
    STALL_EXIT,
    PARTIAL,
    TRAIL_STOP,
    STOP_HIT,
    EOD_CLOSE
}
