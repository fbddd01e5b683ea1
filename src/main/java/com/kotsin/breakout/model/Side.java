package com.kotsin.breakout.model;

/**
 * Trade direction. LONG trades break above resistance, SHORT trades break below support.
 */
public enum Side {
    LONG,
    SHORT;

    /**
     * True when price is strictly beyond the level in this side's breakout direction.
     */
    public boolean isBeyond(double price, double level) {
        return this == LONG ? price > level : price < level;
    }

    /**
     * Signed move from reference to price, positive when favourable for this side.
     */
    public double favourableMove(double reference, double price) {
        return this == LONG ? price - reference : reference - price;
    }

    /**
     * Pivot shifted away from the market by a clearance fraction.
     */
    public double clearanceLevel(double pivot, double clearancePct) {
        return this == LONG ? pivot * (1 + clearancePct) : pivot * (1 - clearancePct);
    }

    /**
     * True when {@code candidate} is a tighter (risk-reducing) stop than {@code current}.
     */
    public boolean isTighterStop(double candidate, double current) {
        return this == LONG ? candidate > current : candidate < current;
    }

    /**
     * True when price has touched or crossed the stop level.
     */
    public boolean isStopHit(double price, double stop) {
        return this == LONG ? price <= stop : price >= stop;
    }

    public Side opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
