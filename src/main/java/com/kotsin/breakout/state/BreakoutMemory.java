package com.kotsin.breakout.state;

import com.kotsin.breakout.model.Side;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * What has happened for one symbol since its pivot was crossed.
 *
 * <p>Only {@link StateTracker} mutates this; everyone else receives a copy through
 * {@link StateTracker#get()}.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString
@Builder(toBuilder = true)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class BreakoutMemory {

    private final Side side;
    private final double pivotPrice;
    private final long breakoutLogicalPosition;
    private final double breakoutPrice;
    private final BreakoutKind breakoutKind;

    // null until the confirmation candle closes
    private Long candleCloseLogicalPosition;
    private double candleClosePrice;

    private int barsHeldBeyondPivot;
    private double volumeRatioAtBreakout;
    private double candleSizePctAtBreakout;

    private int consecutiveImbalanceCount;
    @Builder.Default
    private ImbalanceDirection consecutiveImbalanceDirection = ImbalanceDirection.NONE;
    private double lastImbalancePct;

    private double highestSinceBreakout;
    private double lowestSinceBreakout;

    // null until price pulls back towards the pivot
    private Long pullbackLogicalPosition;
    // breakout extreme at the time of the pullback; a bounce must clear it
    private double retestTrigger;
    // deepest price reached during the pullback
    private double pullbackExtreme;

    private String entryReason;

    public boolean isCandleClosed() {
        return candleCloseLogicalPosition != null;
    }

    public boolean isPullbackDetected() {
        return pullbackLogicalPosition != null;
    }

    BreakoutMemory copy() {
        return toBuilder().build();
    }
}
