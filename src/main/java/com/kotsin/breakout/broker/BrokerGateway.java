package com.kotsin.breakout.broker;

import com.google.common.util.concurrent.RateLimiter;
import com.kotsin.breakout.config.EngineProperties;
import com.kotsin.breakout.model.Side;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Rate-limited, retrying front for a {@link BrokerClient}.
 *
 * <p>Transient {@link BrokerException}s are retried with exponential backoff up to
 * {@code maxAttempts}; permanent ones propagate immediately. Order-bearing calls take a
 * permit from a Guava {@link RateLimiter} first, except on an {@link #unthrottled} gateway,
 * whose broker runs on simulated time and must never wait on the wall clock.
 */
@Slf4j
public class BrokerGateway {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final BrokerClient client;
    private final EngineProperties.Broker config;
    // null when unthrottled
    private final RateLimiter orderLimiter;
    private final Sleeper sleeper;

    public BrokerGateway(BrokerClient client, EngineProperties.Broker config) {
        this(client, config, Thread::sleep);
    }

    public BrokerGateway(BrokerClient client, EngineProperties.Broker config, Sleeper sleeper) {
        this(client, config, RateLimiter.create(config.getOrdersPerSecond()), sleeper);
    }

    private BrokerGateway(BrokerClient client, EngineProperties.Broker config, RateLimiter orderLimiter,
                          Sleeper sleeper) {
        this.client = client;
        this.config = config;
        this.orderLimiter = orderLimiter;
        this.sleeper = sleeper;
    }

    /**
     * Gateway for a simulated broker: no order rate limit and no backoff sleeps. Retries still
     * run, so a transient failure is retried immediately up to {@code maxAttempts}.
     */
    public static BrokerGateway unthrottled(BrokerClient client, EngineProperties.Broker config) {
        return new BrokerGateway(client, config, null, millis -> { });
    }

    public boolean isThrottled() {
        return orderLimiter != null;
    }

    public String submitOrder(OrderRequest request) {
        return withRetry("submitOrder " + request.clientOrderId(), true, () -> client.submitOrder(request));
    }

    public String submitStop(String clientOrderId, String symbol, Side positionSide, int shares, double stopPrice) {
        return withRetry("submitStop " + clientOrderId, true,
                () -> client.submitStop(clientOrderId, symbol, positionSide, shares, stopPrice));
    }

    public void modifyStop(String clientOrderId, int shares, double newStopPrice) {
        withRetry("modifyStop " + clientOrderId, true, () -> {
            client.modifyStop(clientOrderId, shares, newStopPrice);
            return null;
        });
    }

    public void cancelOrder(String clientOrderId) {
        withRetry("cancelOrder " + clientOrderId, true, () -> {
            client.cancelOrder(clientOrderId);
            return null;
        });
    }

    public List<BrokerHolding> currentHoldings() {
        return withRetry("currentHoldings", false, client::currentHoldings);
    }

    public void close() {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.warn("broker_close_failed err={}", e.toString());
        }
    }

    public BrokerClient client() {
        return client;
    }

    private <T> T withRetry(String operation, boolean ordersPermit, Supplier<T> call) {
        int attempt = 0;
        BrokerException last = null;
        while (attempt < config.getMaxAttempts()) {
            attempt++;
            try {
                if (ordersPermit && orderLimiter != null) {
                    acquirePermit(operation);
                }
                return call.get();
            } catch (BrokerException e) {
                last = e;
                if (!e.isTransient()) {
                    log.error("broker_call_failed op={} attempt={} transient=false err={}", operation, attempt, e.getMessage());
                    throw e;
                }
                if (attempt >= config.getMaxAttempts()) {
                    break;
                }
                long delay = backoffDelay(attempt);
                log.warn("broker_call_retry op={} attempt={}/{} delayMs={} err={}",
                        operation, attempt, config.getMaxAttempts(), delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new BrokerException(operation + " interrupted during backoff", ie, false);
                }
            }
        }
        log.error("broker_call_exhausted op={} attempts={} err={}", operation, attempt,
                last != null ? last.getMessage() : "none");
        throw new BrokerException(operation + " failed after " + attempt + " attempts", last, false);
    }

    long backoffDelay(int attempt) {
        long delay = (long) (config.getInitialBackoffMillis() * Math.pow(2, attempt - 1));
        return Math.min(delay, config.getMaxBackoffMillis());
    }

    private void acquirePermit(String operation) {
        if (!orderLimiter.tryAcquire(config.getPermitTimeoutMillis(), TimeUnit.MILLISECONDS)) {
            throw BrokerException.transientFailure("order rate limit timeout for " + operation
                    + " (rate " + orderLimiter.getRate() + "/s)");
        }
    }
}
