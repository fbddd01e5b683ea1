package com.kotsin.breakout.broker;

import com.kotsin.breakout.model.Side;

import java.util.List;

/**
 * Broker connection used by the engine. Implementations report executions as {@link FillEvent}s
 * keyed by the client order id, either synchronously (paper) or through the fills topic (live).
 */
public interface BrokerClient {

    /**
     * Places a market order and returns the broker's own order id.
     */
    String submitOrder(OrderRequest request) throws BrokerException;

    /**
     * Places a resting protective stop for an open position.
     */
    String submitStop(String clientOrderId, String symbol, Side positionSide, int shares, double stopPrice)
            throws BrokerException;

    void modifyStop(String clientOrderId, int shares, double newStopPrice) throws BrokerException;

    void cancelOrder(String clientOrderId) throws BrokerException;

    List<BrokerHolding> currentHoldings() throws BrokerException;

    void close();
}
