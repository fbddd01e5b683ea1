package com.kotsin.breakout.position;

import java.time.Instant;

/**
 * One profit-taking leg. {@code fraction} is of the original position size.
 */
public record PartialExit(
        int level,
        double fraction,
        int shares,
        double price,
        Instant time,
        double pnl
) {
}
