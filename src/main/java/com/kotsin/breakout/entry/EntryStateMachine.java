package com.kotsin.breakout.entry;

import com.kotsin.breakout.buffer.BarBuffer;
import com.kotsin.breakout.buffer.CandleWindow;
import com.kotsin.breakout.buffer.ConfirmationTiming;
import com.kotsin.breakout.buffer.EvictedRangeException;
import com.kotsin.breakout.config.SetupThresholds;
import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.model.OrderFlowSample;
import com.kotsin.breakout.model.PivotLevel;
import com.kotsin.breakout.model.Side;
import com.kotsin.breakout.state.BreakoutMemory;
import com.kotsin.breakout.state.ImbalanceDirection;
import com.kotsin.breakout.state.StateTracker;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Breakout entry state machine for one symbol and one pivot.
 *
 * <pre>
 *   IDLE --price beyond pivot+clearance--> WATCHING_BREAKOUT
 *   WATCHING_BREAKOUT --confirmation candle closes beyond pivot--> AWAITING_CONFIRMATION
 *                     \--strong candle and momentum allowed--> ENTER (MOMENTUM)
 *   AWAITING_CONFIRMATION --single sample | sustained run--> ENTER
 *                         --strong later candle--> ENTER (MOMENTUM, delayed)
 *                         --pullback to pivot, then strong bounce--> ENTER (PULLBACK_RETEST)
 *   any non-IDLE --price back through pivot--> IDLE (REJECT price_reversal)
 * </pre>
 *
 * <p>Every ENTER is checked against the scanner target last: with less than
 * {@code minRoomToTargetPct} left to run the attempt is rejected as {@code insufficient_room}.
 *
 * <p>Every lookback is expressed in logical positions; the bar interval only enters through
 * {@link ConfirmationTiming}. Not thread-safe: the symbol context lock serialises calls.
 */
@Slf4j
public class EntryStateMachine {

    private final String symbol;
    private final PivotLevel pivot;
    private final SetupThresholds thresholds;
    private final StateTracker tracker;
    private final BarBuffer buffer;

    private ConfirmationTiming timing;
    private EntryState state = EntryState.IDLE;
    private boolean lastTickBeyond;

    public EntryStateMachine(PivotLevel pivot, SetupThresholds thresholds, StateTracker tracker,
                             BarBuffer buffer, ConfirmationTiming timing) {
        this.symbol = pivot.getSymbol();
        this.pivot = pivot;
        this.thresholds = thresholds;
        this.tracker = tracker;
        this.buffer = buffer;
        this.timing = timing;
    }

    /**
     * Evaluates one tick. The bar must already be appended at {@code logicalPosition}.
     */
    public EntryDecision evaluate(Bar bar, long logicalPosition, double currentPrice,
                                  OrderFlowSample sample, EntryEligibility eligibility) {
        Side side = pivot.getSideBias();
        try {
            if (state != EntryState.IDLE) {
                EntryDecision early = checkActiveBreakout(bar, logicalPosition, currentPrice, sample, eligibility);
                if (early != null) {
                    return early;
                }
            }
            switch (state) {
                case IDLE:
                    return onIdle(bar, logicalPosition, currentPrice, eligibility);
                case WATCHING_BREAKOUT:
                    return onWatching(bar, logicalPosition, currentPrice, sample);
                case AWAITING_CONFIRMATION:
                    return onAwaiting(bar, logicalPosition, currentPrice, sample, false);
                default:
                    throw new IllegalStateException("Unhandled state " + state);
            }
        } catch (EvictedRangeException e) {
            log.warn("entry_insufficient_history symbol={} pos={} state={} err={}",
                    symbol, logicalPosition, state, e.getMessage());
            reset();
            return EntryDecision.reject(RejectReason.INSUFFICIENT_HISTORY, side, currentPrice,
                    Map.of("requested", e.getRequested(), "oldestRetained", e.getOldestRetained()));
        }
    }

    /**
     * Guards that apply in every non-IDLE state, before any state-specific logic.
     * Returns null when the breakout is still alive.
     */
    private EntryDecision checkActiveBreakout(Bar bar, long logicalPosition, double currentPrice,
                                              OrderFlowSample sample, EntryEligibility eligibility) {
        Side side = pivot.getSideBias();
        BreakoutMemory memory = tracker.get().orElse(null);
        if (memory == null) {
            state = EntryState.IDLE;
            return null;
        }
        if (!side.isBeyond(currentPrice, pivot.getPivotPrice())) {
            log.info("entry_reject symbol={} reason={} state={} price={} pivot={}",
                    symbol, RejectReason.PRICE_REVERSAL.code(), state, currentPrice, pivot.getPivotPrice());
            tracker.invalidate();
            state = EntryState.IDLE;
            lastTickBeyond = false;
            return EntryDecision.reject(RejectReason.PRICE_REVERSAL, side, currentPrice, signals(memory));
        }
        long age = logicalPosition - memory.getBreakoutLogicalPosition();
        if (age > timing.barsFor(thresholds.getMaxBreakoutAgeSeconds())) {
            log.info("entry_reject symbol={} reason={} ageBars={}", symbol, RejectReason.STALE_BREAKOUT.code(), age);
            reset();
            return EntryDecision.reject(RejectReason.STALE_BREAKOUT, side, currentPrice, signals(memory));
        }
        var blocked = eligibility.firstBlock();
        if (blocked.isPresent()) {
            log.info("entry_reject symbol={} reason={} state={}", symbol, blocked.get().code(), state);
            reset();
            return EntryDecision.reject(blocked.get(), side, currentPrice, signals(memory));
        }
        tracker.recordPriceAction(bar, logicalPosition);
        if (sample != null) {
            tracker.recordOrderFlowSample(sample.imbalancePct(), logicalPosition, thresholds.getSustainedThreshold());
        }
        return null;
    }

    private EntryDecision onIdle(Bar bar, long logicalPosition, double currentPrice, EntryEligibility eligibility) {
        Side side = pivot.getSideBias();
        double trigger = side.clearanceLevel(pivot.getPivotPrice(), thresholds.getMinClearancePct());
        boolean beyond = side.isBeyond(currentPrice, trigger);
        boolean freshCross = beyond && !lastTickBeyond;
        lastTickBeyond = beyond;
        // a new attempt needs a new cross; holding beyond the trigger is not one
        if (!freshCross) {
            return EntryDecision.idle(side, currentPrice);
        }
        var blocked = eligibility.firstBlock();
        if (blocked.isPresent()) {
            return EntryDecision.reject(blocked.get(), side, currentPrice,
                    Map.of("pivot", pivot.getPivotPrice(), "attemptsUsed", eligibility.attemptsUsed()));
        }

        long lookbackBars = timing.barsForCandles(thresholds.getVolumeLookbackCandles());
        double avgVolume = CandleWindow.averageBarVolume(buffer, logicalPosition, lookbackBars);
        double volumeRatio = avgVolume > 0 ? bar.volume() / avgVolume : 0.0;
        BreakoutMemory memory = tracker.onPivotCross(currentPrice, logicalPosition, side, pivot.getPivotPrice(),
                bar.bodyPct(), volumeRatio, thresholds);
        state = EntryState.WATCHING_BREAKOUT;
        log.info("entry_watch symbol={} side={} pivot={} price={} pos={} kind={} volRatio={}",
                symbol, side, pivot.getPivotPrice(), currentPrice, logicalPosition,
                memory.getBreakoutKind(), String.format("%.2f", volumeRatio));
        return EntryDecision.waiting(side, currentPrice, state, true, signals(memory));
    }

    private EntryDecision onWatching(Bar bar, long logicalPosition, double currentPrice, OrderFlowSample sample) {
        Side side = pivot.getSideBias();
        BreakoutMemory memory = tracker.get().orElseThrow();
        int barsPerCandle = timing.barsPerConfirmationInterval();
        long closeAt = memory.getBreakoutLogicalPosition() + barsPerCandle;
        if (logicalPosition < closeAt) {
            return EntryDecision.waiting(side, currentPrice, state, false, Map.of());
        }

        CandleWindow.Candle candle = CandleWindow.aggregate(buffer, logicalPosition, barsPerCandle);
        if (!side.isBeyond(candle.close(), pivot.getPivotPrice())) {
            log.info("entry_reject symbol={} reason={} candleClose={} pivot={}",
                    symbol, RejectReason.PRICE_REVERSAL.code(), candle.close(), pivot.getPivotPrice());
            tracker.invalidate();
            state = EntryState.IDLE;
            lastTickBeyond = false;
            return EntryDecision.reject(RejectReason.PRICE_REVERSAL, side, currentPrice, signals(memory));
        }
        long lookbackBars = timing.barsForCandles(thresholds.getVolumeLookbackCandles());
        double volumeRatio = CandleWindow.volumeRatio(buffer, candle, lookbackBars);
        double candlePct = candle.bodyPct();
        tracker.recordCandleClose(logicalPosition, candle.close(), volumeRatio, candlePct);

        boolean strong = candlePct >= thresholds.getStrongCandlePct()
                && volumeRatio >= thresholds.getStrongVolumeRatio();
        if (strong && thresholds.isMomentumConfirmsEntry()) {
            return fire(ConfirmationPath.MOMENTUM, currentPrice, Map.of());
        }
        state = EntryState.AWAITING_CONFIRMATION;
        log.info("entry_await symbol={} candleClose={} candlePct={} volRatio={} strong={}",
                symbol, candle.close(), String.format("%.4f", candlePct), String.format("%.2f", volumeRatio), strong);
        // the sample that arrived with this bar may already confirm
        return onAwaiting(bar, logicalPosition, currentPrice, sample, true);
    }

    private EntryDecision onAwaiting(Bar bar, long logicalPosition, double currentPrice, OrderFlowSample sample,
                                     boolean justArrived) {
        Side side = pivot.getSideBias();
        BreakoutMemory memory = tracker.get().orElseThrow();
        // Path A first; when both hold the decision belongs to A
        if (sample != null && sample.supports(side)
                && sample.magnitude() > thresholds.getSingleSampleThreshold()) {
            return fire(ConfirmationPath.SINGLE_SAMPLE, currentPrice, Map.of());
        }
        ImbalanceDirection wanted = side == Side.LONG ? ImbalanceDirection.BUYING : ImbalanceDirection.SELLING;
        if (memory.getConsecutiveImbalanceDirection() == wanted
                && memory.getConsecutiveImbalanceCount() >= thresholds.getSustainedCountThreshold()) {
            return fire(ConfirmationPath.SUSTAINED, currentPrice, Map.of());
        }
        if (!justArrived) {
            EntryDecision delayed = delayedMomentum(logicalPosition, currentPrice, memory);
            if (delayed != null) {
                return delayed;
            }
            EntryDecision retest = pullbackRetest(bar, logicalPosition, currentPrice, memory);
            if (retest != null) {
                return retest;
            }
        }
        return EntryDecision.waiting(side, currentPrice, state, justArrived, signals(memory));
    }

    /**
     * Re-checks momentum on every later confirmation candle that closes while the breakout
     * is still alive. Returns null when there is nothing to enter on.
     */
    private EntryDecision delayedMomentum(long logicalPosition, double currentPrice, BreakoutMemory memory) {
        if (!thresholds.isMomentumConfirmsEntry() || !memory.isCandleClosed()
                || logicalPosition <= memory.getCandleCloseLogicalPosition()) {
            return null;
        }
        int barsPerCandle = timing.barsPerConfirmationInterval();
        if ((logicalPosition - memory.getBreakoutLogicalPosition()) % barsPerCandle != 0) {
            return null;
        }
        CandleWindow.Candle candle = CandleWindow.aggregate(buffer, logicalPosition, barsPerCandle);
        if (!pivot.getSideBias().isBeyond(candle.close(), pivot.getPivotPrice())) {
            return null;
        }
        long lookbackBars = timing.barsForCandles(thresholds.getVolumeLookbackCandles());
        double volumeRatio = CandleWindow.volumeRatio(buffer, candle, lookbackBars);
        double candlePct = candle.bodyPct();
        log.debug("entry_recheck symbol={} pos={} candlePct={} volRatio={}", symbol, logicalPosition,
                String.format("%.4f", candlePct), String.format("%.2f", volumeRatio));
        if (candlePct < thresholds.getStrongCandlePct() || volumeRatio < thresholds.getStrongVolumeRatio()) {
            return null;
        }
        return fire(ConfirmationPath.MOMENTUM, currentPrice,
                Map.of("delayed", true, "candleVolumeRatio", volumeRatio, "candleSizePct", candlePct));
    }

    /**
     * First marks a pullback when price comes back within {@code pullbackDistancePct} of the pivot.
     * On a later bar, enters when price clears the breakout extreme by {@code bounceThresholdPct}
     * on a strong bar (body and relative volume at momentum level) that moves away from the previous close.
     */
    private EntryDecision pullbackRetest(Bar bar, long logicalPosition, double currentPrice, BreakoutMemory memory) {
        if (!thresholds.isPullbackRetestEntry()) {
            return null;
        }
        Side side = pivot.getSideBias();
        if (!memory.isPullbackDetected()) {
            double distance = Math.abs(currentPrice - pivot.getPivotPrice()) / pivot.getPivotPrice();
            if (distance <= thresholds.getPullbackDistancePct()) {
                tracker.markPullback(logicalPosition, currentPrice);
                log.info("entry_pullback symbol={} price={} pivot={} pos={}",
                        symbol, currentPrice, pivot.getPivotPrice(), logicalPosition);
            }
            return null;
        }
        if (logicalPosition <= memory.getPullbackLogicalPosition()) {
            return null;
        }
        double trigger = side.clearanceLevel(memory.getRetestTrigger(), thresholds.getBounceThresholdPct());
        if (!side.isBeyond(currentPrice, trigger)) {
            return null;
        }
        long lookbackBars = timing.barsForCandles(thresholds.getVolumeLookbackCandles());
        double avgVolume = CandleWindow.averageBarVolume(buffer, logicalPosition, lookbackBars);
        double volumeRatio = avgVolume > 0 ? bar.volume() / avgVolume : 0.0;
        if (volumeRatio < thresholds.getStrongVolumeRatio() || bar.bodyPct() < thresholds.getStrongCandlePct()) {
            return null;
        }
        Bar previous = buffer.get(logicalPosition - 1);
        if (!side.isBeyond(currentPrice, previous.close())) {
            return null;
        }
        return fire(ConfirmationPath.PULLBACK_RETEST, currentPrice,
                Map.of("retestTrigger", trigger, "pullbackExtreme", memory.getPullbackExtreme(),
                        "barVolumeRatio", volumeRatio));
    }

    private EntryDecision fire(ConfirmationPath path, double currentPrice, Map<String, Object> extra) {
        Side side = pivot.getSideBias();
        BreakoutMemory memory = tracker.get().orElseThrow();
        // re-validate against the pivot right before committing
        if (!side.isBeyond(currentPrice, pivot.getPivotPrice())) {
            tracker.invalidate();
            state = EntryState.IDLE;
            lastTickBeyond = false;
            return EntryDecision.reject(RejectReason.PRICE_REVERSAL, side, currentPrice, signals(memory));
        }
        Double target = pivot.getTargetPrice();
        if (target != null) {
            double room = side.favourableMove(currentPrice, target) / currentPrice;
            if (room < thresholds.getMinRoomToTargetPct()) {
                log.info("entry_reject symbol={} reason={} path={} price={} target={} room={}",
                        symbol, RejectReason.INSUFFICIENT_ROOM.code(), path, currentPrice, target,
                        String.format("%.4f", room));
                Map<String, Object> rejected = signals(memory);
                rejected.put("targetPrice", target);
                rejected.put("roomToTargetPct", room);
                reset();
                return EntryDecision.reject(RejectReason.INSUFFICIENT_ROOM, side, currentPrice, rejected);
            }
        }
        String reason = side + " confirmed via " + path;
        tracker.recordEntryReason(reason);
        Map<String, Object> signals = signals(tracker.get().orElseThrow());
        signals.putAll(extra);
        log.info("entry_confirmed symbol={} side={} path={} price={} pivot={} kind={}",
                symbol, side, path, currentPrice, pivot.getPivotPrice(), memory.getBreakoutKind());
        reset();
        return EntryDecision.enter(side, currentPrice, path, signals);
    }

    private Map<String, Object> signals(BreakoutMemory memory) {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("pivot", pivot.getPivotPrice());
        s.put("breakoutPosition", memory.getBreakoutLogicalPosition());
        s.put("breakoutPrice", memory.getBreakoutPrice());
        s.put("kind", memory.getBreakoutKind().name());
        s.put("volumeRatio", memory.getVolumeRatioAtBreakout());
        s.put("candleSizePct", memory.getCandleSizePctAtBreakout());
        s.put("barsHeldBeyondPivot", memory.getBarsHeldBeyondPivot());
        s.put("imbalanceRun", memory.getConsecutiveImbalanceCount());
        s.put("imbalanceDirection", memory.getConsecutiveImbalanceDirection().name());
        s.put("lastImbalancePct", memory.getLastImbalancePct());
        if (memory.getEntryReason() != null) {
            s.put("entryReason", memory.getEntryReason());
        }
        return s;
    }

    /**
     * Back to IDLE and forget the breakout, including pullback history.
     */
    public void reset() {
        tracker.clear();
        state = EntryState.IDLE;
    }

    public void updateTiming(ConfirmationTiming timing) {
        this.timing = timing;
    }

    public EntryState getState() {
        return state;
    }

    public PivotLevel getPivot() {
        return pivot;
    }

    public SetupThresholds getThresholds() {
        return thresholds;
    }
}
