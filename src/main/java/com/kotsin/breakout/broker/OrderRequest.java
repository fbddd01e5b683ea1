package com.kotsin.breakout.broker;

/**
 * Market order. {@code clientOrderId} is generated by the engine before submission, so fills
 * can be correlated even when the broker reports them before {@code submitOrder} returns.
 */
public record OrderRequest(
        String clientOrderId,
        String symbol,
        OrderAction action,
        int shares,
        double referencePrice
) {
}
