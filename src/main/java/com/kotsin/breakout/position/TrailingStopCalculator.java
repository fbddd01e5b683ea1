package com.kotsin.breakout.position;

import com.kotsin.breakout.config.SetupThresholds;
import com.kotsin.breakout.model.Side;

import java.util.OptionalDouble;

/**
 * Progressive trailing stop. Trailing starts once the favourable move reaches
 * {@code trailActivationPct} or a partial has been taken, and then follows the best price
 * seen by {@code trailDistancePct}.
 */
public class TrailingStopCalculator {

    public boolean isActive(Position position, double price, SetupThresholds thresholds) {
        return position.isTrailing()
                || position.hasPartials()
                || position.gainPct(price) >= thresholds.getTrailActivationPct();
    }

    /**
     * New stop for the position, or empty when trailing is inactive or the candidate would not
     * tighten the current stop. Expects the position extremes to include {@code price}.
     */
    public OptionalDouble tighterStop(Position position, double price, SetupThresholds thresholds) {
        if (!isActive(position, price, thresholds)) {
            return OptionalDouble.empty();
        }
        double candidate = position.getSide() == Side.LONG
                ? position.getHighestPrice() * (1 - thresholds.getTrailDistancePct())
                : position.getLowestPrice() * (1 + thresholds.getTrailDistancePct());
        if (!position.getSide().isTighterStop(candidate, position.getStopPrice())) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(candidate);
    }
}
