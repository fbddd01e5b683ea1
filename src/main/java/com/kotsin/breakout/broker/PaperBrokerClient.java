package com.kotsin.breakout.broker;

import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.model.Side;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Simulated broker for replay and paper sessions.
 *
 * <p>Market orders fill immediately at the last known price and the fill is delivered to the
 * listener before {@link #submitOrder} returns. Resting stops trigger inside {@link #onBar}
 * when the bar trades through them; those fills arrive unrequested, like a live stop would.
 * Fill ids are sequential, so the same inputs always produce the same fills.
 */
@Slf4j
public class PaperBrokerClient implements BrokerClient {

    private static final class RestingStop {
        final String clientOrderId;
        final String symbol;
        final Side positionSide;
        int shares;
        double stopPrice;

        RestingStop(String clientOrderId, String symbol, Side positionSide, int shares, double stopPrice) {
            this.clientOrderId = clientOrderId;
            this.symbol = symbol;
            this.positionSide = positionSide;
            this.shares = shares;
            this.stopPrice = stopPrice;
        }
    }

    private static final class Holding {
        long netShares;
        double averagePrice;
    }

    private final Map<String, Double> lastPrice = new HashMap<>();
    private final Map<String, Instant> lastTime = new HashMap<>();
    private final Map<String, RestingStop> stops = new LinkedHashMap<>();
    private final Map<String, Holding> holdings = new HashMap<>();
    private Consumer<FillEvent> fillListener = fill -> { };
    private long fillSequence;

    private int failuresToInject;
    private boolean injectTransient;
    private boolean closed;

    public void setFillListener(Consumer<FillEvent> fillListener) {
        this.fillListener = fillListener;
    }

    /**
     * Marks the symbol at the bar close and triggers any stop the bar traded through.
     * Call before the engine sees the bar.
     */
    public void onBar(Bar bar) {
        lastPrice.put(bar.symbol(), bar.close());
        lastTime.put(bar.symbol(), bar.openTime());
        List<RestingStop> triggered = new ArrayList<>();
        for (RestingStop stop : stops.values()) {
            if (!stop.symbol.equals(bar.symbol())) {
                continue;
            }
            boolean hit = stop.positionSide == Side.LONG ? bar.low() <= stop.stopPrice : bar.high() >= stop.stopPrice;
            if (hit) {
                triggered.add(stop);
            }
        }
        for (RestingStop stop : triggered) {
            stops.remove(stop.clientOrderId);
            // gap through the stop fills at the open
            double price = stop.positionSide == Side.LONG
                    ? Math.min(stop.stopPrice, bar.open())
                    : Math.max(stop.stopPrice, bar.open());
            log.info("paper_stop_triggered symbol={} order={} stop={} fill={}",
                    stop.symbol, stop.clientOrderId, stop.stopPrice, price);
            fill(stop.clientOrderId, stop.symbol, OrderAction.closing(stop.positionSide), stop.shares, price);
        }
    }

    public void markPrice(String symbol, double price, Instant time) {
        lastPrice.put(symbol, price);
        lastTime.put(symbol, time);
    }

    /**
     * Makes the next {@code count} order submissions fail.
     */
    public void failNextSubmissions(int count, boolean transientFailure) {
        this.failuresToInject = count;
        this.injectTransient = transientFailure;
    }

    @Override
    public String submitOrder(OrderRequest request) {
        ensureOpen();
        if (failuresToInject > 0) {
            failuresToInject--;
            throw new BrokerException("injected failure for " + request.clientOrderId(), injectTransient);
        }
        double price = lastPrice.getOrDefault(request.symbol(), request.referencePrice());
        fill(request.clientOrderId(), request.symbol(), request.action(), request.shares(), price);
        return "PAPER-" + request.clientOrderId();
    }

    @Override
    public String submitStop(String clientOrderId, String symbol, Side positionSide, int shares, double stopPrice) {
        ensureOpen();
        stops.put(clientOrderId, new RestingStop(clientOrderId, symbol, positionSide, shares, stopPrice));
        return "PAPER-" + clientOrderId;
    }

    @Override
    public void modifyStop(String clientOrderId, int shares, double newStopPrice) {
        ensureOpen();
        RestingStop stop = stops.get(clientOrderId);
        if (stop == null) {
            throw BrokerException.permanent("no resting stop " + clientOrderId);
        }
        stop.shares = shares;
        stop.stopPrice = newStopPrice;
    }

    @Override
    public void cancelOrder(String clientOrderId) {
        ensureOpen();
        stops.remove(clientOrderId);
    }

    @Override
    public List<BrokerHolding> currentHoldings() {
        ensureOpen();
        List<BrokerHolding> out = new ArrayList<>();
        holdings.forEach((symbol, h) -> {
            if (h.netShares != 0) {
                Side side = h.netShares > 0 ? Side.LONG : Side.SHORT;
                out.add(new BrokerHolding(symbol, side, (int) Math.abs(h.netShares), h.averagePrice));
            }
        });
        out.sort(Comparator.comparing(BrokerHolding::symbol));
        return out;
    }

    /**
     * Seeds a holding, e.g. one carried over from a previous process.
     */
    public void seedHolding(String symbol, Side side, int shares, double averagePrice) {
        Holding h = holdings.computeIfAbsent(symbol, s -> new Holding());
        h.netShares = side == Side.LONG ? shares : -shares;
        h.averagePrice = averagePrice;
    }

    public boolean hasRestingStop(String clientOrderId) {
        return stops.containsKey(clientOrderId);
    }

    public double restingStopPrice(String clientOrderId) {
        RestingStop stop = stops.get(clientOrderId);
        if (stop == null) {
            throw new IllegalArgumentException("no resting stop " + clientOrderId);
        }
        return stop.stopPrice;
    }

    @Override
    public void close() {
        closed = true;
        log.info("paper_broker_closed holdings={} restingStops={}", holdings.size(), stops.size());
    }

    public boolean isClosed() {
        return closed;
    }

    private void fill(String clientOrderId, String symbol, OrderAction action, int shares, double price) {
        Holding h = holdings.computeIfAbsent(symbol, s -> new Holding());
        long signed = action == OrderAction.BUY ? shares : -shares;
        long before = h.netShares;
        long after = before + signed;
        if (before == 0 || Long.signum(before) == Long.signum(signed)) {
            h.averagePrice = (h.averagePrice * Math.abs(before) + price * shares) / Math.abs(after);
        } else if (after == 0) {
            h.averagePrice = 0;
        }
        h.netShares = after;

        fillSequence++;
        FillEvent event = new FillEvent("PF-" + fillSequence, clientOrderId, symbol, action, shares, price,
                lastTime.getOrDefault(symbol, Instant.EPOCH));
        fillListener.accept(event);
    }

    private void ensureOpen() {
        if (closed) {
            throw BrokerException.permanent("paper broker is closed");
        }
    }
}
