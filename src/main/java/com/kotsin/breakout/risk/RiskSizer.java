package com.kotsin.breakout.risk;

import lombok.extern.slf4j.Slf4j;

/**
 * Position sizing: the smallest of the dollar-risk cap, the position-value cap and the share cap.
 *
 * <pre>
 *   shares = min( floor(account * riskFraction / |entry - stop|),
 *                 floor(maxPositionValue / entry),
 *                 maxShares )
 * </pre>
 *
 * Stateless; safe to share across symbols.
 */
@Slf4j
public class RiskSizer {

    public SizingResult size(double accountSize, double riskFraction, double entryPrice, double stopPrice,
                             double maxPositionValue, int maxShares) {
        if (!(accountSize > 0) || !(riskFraction > 0) || !(maxPositionValue > 0) || maxShares <= 0) {
            throw new SizingException("caps must be > 0: account=" + accountSize + " risk=" + riskFraction
                    + " maxValue=" + maxPositionValue + " maxShares=" + maxShares);
        }
        if (!(entryPrice > 0) || !Double.isFinite(stopPrice)) {
            throw new SizingException("invalid prices entry=" + entryPrice + " stop=" + stopPrice);
        }
        double stopDistance = Math.abs(entryPrice - stopPrice);
        if (stopDistance == 0) {
            throw new SizingException("zero stop distance at entry " + entryPrice);
        }
        long riskCap = (long) Math.floor(accountSize * riskFraction / stopDistance);
        long valueCap = (long) Math.floor(maxPositionValue / entryPrice);
        long shares = Math.min(Math.min(riskCap, valueCap), maxShares);
        if (shares <= 0) {
            throw new SizingException("computed size is zero (riskCap=" + riskCap + " valueCap=" + valueCap
                    + " maxShares=" + maxShares + ")");
        }
        SizingResult result = new SizingResult((int) shares, riskCap, valueCap, maxShares, stopDistance);
        log.debug("sizing entry={} stop={} riskCap={} valueCap={} maxShares={} shares={} bound={}",
                entryPrice, stopPrice, riskCap, valueCap, maxShares, shares, result.bindingCap());
        return result;
    }

    /**
     * Rejects a size whose value exceeds the position cap plus its tolerance buffer.
     */
    public void validatePreTrade(int shares, double entryPrice, double maxPositionValue, double bufferFraction) {
        double value = shares * entryPrice;
        double limit = maxPositionValue * (1 + bufferFraction);
        if (shares <= 0 || value > limit) {
            throw new SizingException("position value " + value + " for " + shares + " shares exceeds limit " + limit);
        }
    }
}
