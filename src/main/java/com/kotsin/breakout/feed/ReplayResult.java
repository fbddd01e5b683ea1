package com.kotsin.breakout.feed;

import com.kotsin.breakout.audit.DecisionRecord;
import com.kotsin.breakout.position.ClosedTrade;
import com.kotsin.breakout.position.DailySummary;
import com.kotsin.breakout.position.Position;

import java.util.List;

/**
 * Everything a replay run produced. Two runs over the same input compare equal.
 */
public record ReplayResult(
        List<DecisionRecord> decisions,
        List<ClosedTrade> trades,
        List<Position> openPositions,
        DailySummary summary,
        long ticksProcessed,
        long ticksRejected,
        int samplesDropped
) {
}
