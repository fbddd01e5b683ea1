package com.kotsin.breakout.state;

/**
 * Direction of a run of order-flow samples. Positive imbalance is selling, negative is buying.
 */
public enum ImbalanceDirection {
    BUYING,
    SELLING,
    NONE;

    public static ImbalanceDirection of(double imbalancePct) {
        if (imbalancePct < 0) {
            return BUYING;
        }
        if (imbalancePct > 0) {
            return SELLING;
        }
        return NONE;
    }
}
