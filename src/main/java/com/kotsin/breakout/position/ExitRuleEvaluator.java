package com.kotsin.breakout.position;

import com.kotsin.breakout.config.SetupThresholds;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Exit rules in fixed order; the first one that exits wins.
 *
 * <ol>
 *   <li>stall: inside the stall window with no progress and no partial taken</li>
 *   <li>partial: next configured gain level reached</li>
 *   <li>trailing update (never an exit by itself)</li>
 *   <li>stop hit, against the stop after any trailing update</li>
 *   <li>end of day flatten</li>
 * </ol>
 *
 * Pure: the caller applies the returned action.
 */
@RequiredArgsConstructor
public class ExitRuleEvaluator {

    private final TrailingStopCalculator trailing;
    private final LocalTime flattenTime;
    private final ZoneId zone;

    public ExitAction evaluate(Position position, double price, Instant time, SetupThresholds thresholds) {
        if (isStalled(position, price, time, thresholds)) {
            return ExitAction.full(ExitReason.STALL_EXIT, OptionalDouble.empty());
        }

        List<SetupThresholds.PartialLevel> levels = thresholds.getPartials();
        int next = position.getNextPartialLevel();
        if (next < levels.size() && position.gainPct(price) >= levels.get(next).getGainPct()) {
            return ExitAction.partial(next, levels.get(next).getFraction());
        }

        OptionalDouble newStop = trailing.tighterStop(position, price, thresholds);
        double effectiveStop = newStop.orElse(position.getStopPrice());
        if (position.getSide().isStopHit(price, effectiveStop)) {
            boolean trailed = position.isTrailing() || newStop.isPresent();
            return ExitAction.full(trailed ? ExitReason.TRAIL_STOP : ExitReason.STOP_HIT, newStop);
        }

        if (!time.atZone(zone).toLocalTime().isBefore(flattenTime)) {
            return ExitAction.full(ExitReason.EOD_CLOSE, newStop);
        }
        return ExitAction.none(newStop);
    }

    boolean isStalled(Position position, double price, Instant time, SetupThresholds thresholds) {
        if (position.hasPartials()) {
            return false;
        }
        double minutesInTrade = Duration.between(position.getEntryTime(), time).getSeconds() / 60.0;
        if (minutesInTrade < thresholds.getStallWindowStartMinutes()
                || minutesInTrade > thresholds.getStallWindowEndMinutes()) {
            return false;
        }
        return position.gainPct(price) <= thresholds.getStallTolerancePct();
    }
}
