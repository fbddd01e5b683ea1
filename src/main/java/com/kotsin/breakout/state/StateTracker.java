package com.kotsin.breakout.state;

import com.kotsin.breakout.config.SetupThresholds;
import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.model.Side;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Per-symbol breakout memory. Created lazily on the first pivot touch and cleared on
 * invalidation, confirmation or session reset.
 *
 * <p>Not thread-safe; the symbol context lock guards it.
 */
@Slf4j
public class StateTracker {

    private final String symbol;

    private BreakoutMemory current;

    // kind of the last memory dropped by a reversal, used to recognise a pullback re-cross
    private BreakoutKind lastInvalidatedKind;

    public StateTracker(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Starts (or overwrites) the memory for a new cross of the pivot.
     *
     * @param candleSizePct body of the crossing bar as a fraction of its open
     * @param volumeRatio   crossing bar volume against the recent per-bar average
     */
    public BreakoutMemory onPivotCross(double price, long logicalPosition, Side side, double pivotPrice,
                                       double candleSizePct, double volumeRatio, SetupThresholds thresholds) {
        BreakoutKind kind = classify(price, pivotPrice, candleSizePct, volumeRatio, thresholds);
        current = BreakoutMemory.builder()
                .side(side)
                .pivotPrice(pivotPrice)
                .breakoutLogicalPosition(logicalPosition)
                .breakoutPrice(price)
                .breakoutKind(kind)
                .volumeRatioAtBreakout(volumeRatio)
                .candleSizePctAtBreakout(candleSizePct)
                .highestSinceBreakout(price)
                .lowestSinceBreakout(price)
                .barsHeldBeyondPivot(1)
                .build();
        lastInvalidatedKind = null;
        log.debug("breakout_memory_start symbol={} side={} pivot={} price={} pos={} kind={} candlePct={} volRatio={}",
                symbol, side, pivotPrice, price, logicalPosition, kind, candleSizePct, volumeRatio);
        return current.copy();
    }

    private BreakoutKind classify(double price, double pivotPrice, double candleSizePct, double volumeRatio,
                                  SetupThresholds thresholds) {
        BreakoutKind previous = current != null ? current.getBreakoutKind() : lastInvalidatedKind;
        if (previous == BreakoutKind.STRONG
                && Math.abs(price - pivotPrice) / pivotPrice <= thresholds.getPullbackDistancePct()) {
            return BreakoutKind.PULLBACK;
        }
        if (candleSizePct >= thresholds.getStrongCandlePct() && volumeRatio >= thresholds.getStrongVolumeRatio()) {
            return BreakoutKind.STRONG;
        }
        return BreakoutKind.WEAK;
    }

    /**
     * Updates the running imbalance count. Ignored while no breakout is being tracked.
     *
     * <p>A sample whose magnitude exceeds {@code sustainedThreshold} extends the run when its
     * direction matches and restarts it at 1 when it flips. Any other sample breaks the run.
     */
    public void recordOrderFlowSample(double imbalancePct, long logicalPosition, double sustainedThreshold) {
        if (current == null) {
            return;
        }
        current.setLastImbalancePct(imbalancePct);
        ImbalanceDirection direction = ImbalanceDirection.of(imbalancePct);
        if (Math.abs(imbalancePct) > sustainedThreshold && direction != ImbalanceDirection.NONE) {
            if (direction == current.getConsecutiveImbalanceDirection()) {
                current.setConsecutiveImbalanceCount(current.getConsecutiveImbalanceCount() + 1);
            } else {
                current.setConsecutiveImbalanceDirection(direction);
                current.setConsecutiveImbalanceCount(1);
            }
        } else {
            current.setConsecutiveImbalanceDirection(ImbalanceDirection.NONE);
            current.setConsecutiveImbalanceCount(0);
        }
        log.trace("order_flow symbol={} pos={} imbalance={} run={} dir={}", symbol, logicalPosition, imbalancePct,
                current.getConsecutiveImbalanceCount(), current.getConsecutiveImbalanceDirection());
    }

    /**
     * Extends the price extremes and the count of bars that closed beyond the pivot.
     */
    public void recordPriceAction(Bar bar, long logicalPosition) {
        if (current == null || logicalPosition <= current.getBreakoutLogicalPosition()) {
            return;
        }
        current.setHighestSinceBreakout(Math.max(current.getHighestSinceBreakout(), bar.high()));
        current.setLowestSinceBreakout(Math.min(current.getLowestSinceBreakout(), bar.low()));
        if (current.getSide().isBeyond(bar.close(), current.getPivotPrice())) {
            current.setBarsHeldBeyondPivot(current.getBarsHeldBeyondPivot() + 1);
        }
        if (current.isPullbackDetected() && logicalPosition > current.getPullbackLogicalPosition()) {
            current.setPullbackExtreme(current.getSide() == Side.LONG
                    ? Math.min(current.getPullbackExtreme(), bar.low())
                    : Math.max(current.getPullbackExtreme(), bar.high()));
        }
    }

    /**
     * Records that price came back towards the pivot without crossing it. The breakout extreme
     * seen so far becomes the level a bounce has to clear. Only the first pullback is kept.
     */
    public void markPullback(long logicalPosition, double price) {
        if (current == null || current.isPullbackDetected()) {
            return;
        }
        current.setPullbackLogicalPosition(logicalPosition);
        current.setRetestTrigger(current.getSide() == Side.LONG
                ? current.getHighestSinceBreakout() : current.getLowestSinceBreakout());
        current.setPullbackExtreme(price);
        log.debug("breakout_pullback symbol={} pos={} price={} trigger={}",
                symbol, logicalPosition, price, current.getRetestTrigger());
    }

    public void recordCandleClose(long logicalPosition, double closePrice, double volumeRatio, double candleSizePct) {
        if (current == null) {
            return;
        }
        current.setCandleCloseLogicalPosition(logicalPosition);
        current.setCandleClosePrice(closePrice);
        current.setVolumeRatioAtBreakout(volumeRatio);
        current.setCandleSizePctAtBreakout(candleSizePct);
    }

    public void recordEntryReason(String reason) {
        if (current != null) {
            current.setEntryReason(reason);
        }
    }

    /**
     * Drops the memory after the price came back through the pivot. The dropped kind is kept
     * so the next cross can be recognised as a pullback.
     */
    public void invalidate() {
        if (current != null) {
            lastInvalidatedKind = current.getBreakoutKind();
            log.debug("breakout_memory_invalidated symbol={} kind={}", symbol, lastInvalidatedKind);
        }
        current = null;
    }

    /**
     * Clears everything, including pullback history. Used on confirmation and session reset.
     */
    public void clear() {
        current = null;
        lastInvalidatedKind = null;
    }

    public Optional<BreakoutMemory> get() {
        return current == null ? Optional.empty() : Optional.of(current.copy());
    }

    public boolean isTracking() {
        return current != null;
    }

    public String getSymbol() {
        return symbol;
    }
}
