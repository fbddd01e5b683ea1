package com.kotsin.breakout.audit;

import com.kotsin.breakout.entry.EntryDecision;
import com.kotsin.breakout.risk.SizingResult;

import java.time.Instant;
import java.util.Map;

/**
 * Audit entry for one evaluated entry attempt, with the signals that shaped it.
 */
public record DecisionRecord(
        String symbol,
        Instant time,
        long logicalPosition,
        String action,
        String reason,
        String side,
        double referencePrice,
        String path,
        String stateAfter,
        Integer shares,
        Map<String, Object> signals
) {

    public static DecisionRecord of(String symbol, Instant time, long logicalPosition, EntryDecision decision,
                                    SizingResult sizing) {
        return new DecisionRecord(
                symbol,
                time,
                logicalPosition,
                decision.action().name(),
                decision.reason() != null ? decision.reason().code() : null,
                decision.side() != null ? decision.side().name() : null,
                decision.referencePrice(),
                decision.path() != null ? decision.path().name() : null,
                decision.stateAfter() != null ? decision.stateAfter().name() : null,
                sizing != null ? sizing.shares() : null,
                decision.signals());
    }
}
