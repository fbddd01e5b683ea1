package com.kotsin.breakout.broker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Broker execution report. {@code orderId} is the client order id of the order that filled;
 * {@code fillId} is unique per execution and used to drop duplicates.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FillEvent(
        String fillId,
        String orderId,
        String symbol,
        OrderAction action,
        int shares,
        double price,
        Instant time
) {
}
