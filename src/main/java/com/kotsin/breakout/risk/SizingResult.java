package com.kotsin.breakout.risk;

/**
 * Shares plus the three caps that produced them, kept for the decision audit.
 */
public record SizingResult(
        int shares,
        long riskCapShares,
        long valueCapShares,
        int maxShares,
        double stopDistance
) {

    public double positionValue(double entryPrice) {
        return shares * entryPrice;
    }

    public double dollarRisk() {
        return shares * stopDistance;
    }

    /**
     * Which cap bound the result: RISK, VALUE or SHARES.
     */
    public String bindingCap() {
        if (shares == riskCapShares) {
            return "RISK";
        }
        if (shares == valueCapShares) {
            return "VALUE";
        }
        return "SHARES";
    }
}
