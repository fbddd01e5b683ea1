package com.kotsin.breakout.position;

import com.github.benmanes.caffeine.cache.Cache;
import com.kotsin.breakout.audit.ClosedTradeSink;
import com.kotsin.breakout.broker.BrokerException;
import com.kotsin.breakout.broker.BrokerGateway;
import com.kotsin.breakout.broker.FillEvent;
import com.kotsin.breakout.broker.OrderAction;
import com.kotsin.breakout.broker.OrderRequest;
import com.kotsin.breakout.config.EngineProperties;
import com.kotsin.breakout.config.SetupThresholds;
import com.kotsin.breakout.entry.EntryDecision;
import com.kotsin.breakout.entry.RejectReason;
import com.kotsin.breakout.model.PivotLevel;
import com.kotsin.breakout.model.Side;
import com.kotsin.breakout.risk.AccountExposureAggregator;
import com.kotsin.breakout.risk.RiskSizer;
import com.kotsin.breakout.risk.SizingException;
import com.kotsin.breakout.risk.SizingResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns open positions, the orders behind them and the session ledger.
 *
 * <p>Positions open and close on fill confirmation only: submitting an order records a
 * {@link PendingOrder} keyed by the engine-generated client order id, and {@link #onFill}
 * applies the fill. Calls for one symbol are serialised by the caller (the symbol lock); the
 * maps are concurrent because different symbols run in parallel.
 */
@Slf4j
public class PositionManager {

    /**
     * Notified after every change to positions, pending orders or attempt counts.
     */
    @FunctionalInterface
    public interface MutationListener {
        void onMutation(String symbol);
    }

    public record EntryOutcome(boolean submitted, RejectReason reason, String clientOrderId,
                               SizingResult sizing, String detail) {

        static EntryOutcome accepted(String clientOrderId, SizingResult sizing) {
            return new EntryOutcome(true, null, clientOrderId, sizing, null);
        }

        static EntryOutcome rejected(RejectReason reason, SizingResult sizing, String detail) {
            return new EntryOutcome(false, reason, null, sizing, detail);
        }
    }

    private final EngineProperties properties;
    private final RiskSizer sizer;
    private final AccountExposureAggregator exposure;
    private final BrokerGateway broker;
    private final ExitRuleEvaluator exitRules;
    private final Cache<String, Boolean> processedFills;
    private final ClosedTradeSink tradeSink;

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final Map<String, PendingOrder> pendingOrders = new ConcurrentHashMap<>();
    // protective stop client id -> symbol
    private final Map<String, String> stopOrders = new ConcurrentHashMap<>();
    private final Map<String, Integer> attemptCounts = new ConcurrentHashMap<>();
    private final List<ClosedTrade> ledger = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong orderSequence = new AtomicLong();

    // Last complete state per symbol, copied at the end of each mutation while the symbol lock is
    // held. Snapshots read only these, never the live objects another symbol's thread may be changing.
    private final Map<String, Position> committedPositions = new ConcurrentHashMap<>();
    private final Map<String, List<PendingOrder>> committedPending = new ConcurrentHashMap<>();
    private final Map<String, Integer> committedAttempts = new ConcurrentHashMap<>();

    private volatile MutationListener mutationListener = symbol -> { };
    private volatile LocalDate sessionDate;

    public PositionManager(EngineProperties properties, RiskSizer sizer, AccountExposureAggregator exposure,
                           BrokerGateway broker, Cache<String, Boolean> processedFills, ClosedTradeSink tradeSink) {
        this.properties = properties;
        this.sizer = sizer;
        this.exposure = exposure;
        this.broker = broker;
        this.processedFills = processedFills;
        this.tradeSink = tradeSink;
        this.exitRules = new ExitRuleEvaluator(new TrailingStopCalculator(),
                properties.getFlattenTime(), properties.zone());
    }

    public void setMutationListener(MutationListener mutationListener) {
        this.mutationListener = mutationListener;
    }

    // ---------------------------------------------------------------- entries

    /**
     * Sizes and submits an entry for a confirmed breakout. The position itself is created when
     * the fill arrives, which for a synchronous broker happens before this method returns.
     */
    public EntryOutcome requestEntry(PivotLevel pivot, EntryDecision decision, long logicalPosition, Instant time) {
        String symbol = pivot.getSymbol();
        Side side = decision.side();
        double entryPrice = decision.referencePrice();
        SetupThresholds thresholds = properties.thresholds(pivot.getSetupType());
        EngineProperties.Account account = properties.getAccount();

        double offset = thresholds.getInitialStopOffsetPct();
        double stopPrice = side == Side.LONG
                ? pivot.getPivotPrice() * (1 - offset)
                : pivot.getPivotPrice() * (1 + offset);

        SizingResult sizing;
        try {
            if (side.favourableMove(stopPrice, entryPrice) <= 0) {
                throw new SizingException("stop " + stopPrice + " is not behind entry " + entryPrice + " for " + side);
            }
            sizing = sizer.size(account.getAccountSize(), account.getRiskFraction(), entryPrice, stopPrice,
                    account.getMaxPositionValue(), account.getMaxShares());
            sizer.validatePreTrade(sizing.shares(), entryPrice, account.getMaxPositionValue(),
                    account.getPositionValueBufferFraction());
        } catch (SizingException e) {
            log.warn("entry_rejected symbol={} reason={} detail={}", symbol, RejectReason.SIZING_REJECTED.code(), e.getMessage());
            return EntryOutcome.rejected(RejectReason.SIZING_REJECTED, null, e.getMessage());
        }

        if (!exposure.tryReserve(symbol, sizing.positionValue(entryPrice), sizing.dollarRisk())) {
            return EntryOutcome.rejected(RejectReason.EXPOSURE_LIMIT, sizing,
                    "open exposure " + exposure.totalExposure() + " + " + sizing.positionValue(entryPrice));
        }

        String clientOrderId = nextOrderId(symbol, "ENT");
        PendingOrder order = PendingOrder.builder()
                .clientOrderId(clientOrderId)
                .symbol(symbol)
                .purpose(OrderPurpose.ENTRY)
                .side(side)
                .shares(sizing.shares())
                .referencePrice(entryPrice)
                .submittedAt(time)
                .stopPrice(stopPrice)
                .pivotPrice(pivot.getPivotPrice())
                .pivotKey(pivot.pivotKey())
                .setupType(pivot.getSetupType())
                .logicalPosition(logicalPosition)
                .build();
        pendingOrders.put(clientOrderId, order);
        try {
            broker.submitOrder(new OrderRequest(clientOrderId, symbol, OrderAction.opening(side),
                    sizing.shares(), entryPrice));
        } catch (BrokerException e) {
            pendingOrders.remove(clientOrderId);
            exposure.release(symbol);
            log.error("entry_rejected symbol={} reason={} order={} err={}",
                    symbol, RejectReason.BROKER_FAILURE.code(), clientOrderId, e.getMessage());
            return EntryOutcome.rejected(RejectReason.BROKER_FAILURE, sizing, e.getMessage());
        }
        log.info("entry_submitted symbol={} side={} shares={} ref={} stop={} order={} bound={}",
                symbol, side, sizing.shares(), entryPrice, stopPrice, clientOrderId, sizing.bindingCap());
        mutated(symbol);
        return EntryOutcome.accepted(clientOrderId, sizing);
    }

    // ---------------------------------------------------------------- fills

    /**
     * Applies a broker execution. Duplicates (same fill id) are ignored.
     */
    public void onFill(FillEvent fill) {
        if (fill.fillId() != null && processedFills.asMap().putIfAbsent(fill.fillId(), Boolean.TRUE) != null) {
            log.debug("fill_duplicate fillId={} order={}", fill.fillId(), fill.orderId());
            return;
        }
        PendingOrder order = pendingOrders.remove(fill.orderId());
        if (order != null) {
            switch (order.getPurpose()) {
                case ENTRY -> openPosition(order, fill);
                case PARTIAL -> applyPartial(order, fill);
                case EXIT -> {
                    Position position = positions.get(order.getSymbol());
                    if (position == null) {
                        log.warn("exit_fill_without_position symbol={} order={}", order.getSymbol(), fill.orderId());
                        return;
                    }
                    closePosition(position, fill.price(), order.getSubmittedAt(), order.getReason(), false);
                }
                default -> throw new IllegalStateException("Unhandled purpose " + order.getPurpose());
            }
            return;
        }
        String stopSymbol = stopOrders.get(fill.orderId());
        if (stopSymbol != null) {
            onExternalStopFill(stopSymbol, fill);
            return;
        }
        log.warn("fill_unmatched fillId={} order={} symbol={} shares={} price={}",
                fill.fillId(), fill.orderId(), fill.symbol(), fill.shares(), fill.price());
    }

    private void openPosition(PendingOrder order, FillEvent fill) {
        String symbol = order.getSymbol();
        if (positions.containsKey(symbol)) {
            log.error("entry_fill_with_open_position symbol={} order={}", symbol, order.getClientOrderId());
            return;
        }
        int shares = fill.shares();
        double price = fill.price();
        Position position = Position.builder()
                .symbol(symbol)
                .side(order.getSide())
                .setupType(order.getSetupType())
                .pivotKey(order.getPivotKey())
                .pivotPrice(order.getPivotPrice())
                .entryPrice(price)
                .entryTime(order.getSubmittedAt())
                .entryLogicalPosition(order.getLogicalPosition())
                .entryOrderId(order.getClientOrderId())
                .shares(shares)
                .remainingShares(shares)
                .stopPrice(order.getStopPrice())
                .initialStopPrice(order.getStopPrice())
                .highestPrice(price)
                .lowestPrice(price)
                .fees(commission(shares))
                .build();
        position.getBrokerOrderIds().add(order.getClientOrderId());
        positions.put(symbol, position);
        attemptCounts.merge(order.getPivotKey(), 1, Integer::sum);
        exposure.adjust(symbol, shares * price, shares * Math.abs(price - order.getStopPrice()));

        String stopId = nextOrderId(symbol, "STP");
        try {
            broker.submitStop(stopId, symbol, position.getSide(), shares, position.getStopPrice());
            position.setStopOrderId(stopId);
            position.getBrokerOrderIds().add(stopId);
            stopOrders.put(stopId, symbol);
        } catch (BrokerException e) {
            position.setStatus(PositionStatus.BROKER_ERROR);
            log.error("stop_submit_failed symbol={} order={} err={} status=BROKER_ERROR", symbol, stopId, e.getMessage());
        }
        log.info("position_opened symbol={} side={} shares={} entry={} stop={} pivot={} attempts={}",
                symbol, position.getSide(), shares, price, position.getStopPrice(), order.getPivotPrice(),
                attemptCounts.get(order.getPivotKey()));
        mutated(symbol);
    }

    private void applyPartial(PendingOrder order, FillEvent fill) {
        Position position = positions.get(order.getSymbol());
        if (position == null) {
            log.warn("partial_fill_without_position symbol={} order={}", order.getSymbol(), fill.orderId());
            return;
        }
        int shares = Math.min(fill.shares(), position.getRemainingShares());
        double pnl = position.getSide().favourableMove(position.getEntryPrice(), fill.price()) * shares;
        position.getPartialsTaken().add(new PartialExit(order.getPartialLevel(),
                (double) shares / position.getShares(), shares, fill.price(), order.getSubmittedAt(), pnl));
        position.setRemainingShares(position.getRemainingShares() - shares);
        position.setNextPartialLevel(Math.max(position.getNextPartialLevel(), order.getPartialLevel() + 1));
        position.setRealizedPnl(position.getRealizedPnl() + pnl);
        position.setFees(position.getFees() + commission(shares));
        position.getBrokerOrderIds().add(order.getClientOrderId());

        SetupThresholds thresholds = properties.thresholds(position.getSetupType());
        if (thresholds.isBreakevenAfterPartial() && position.getPartialsTaken().size() == 1) {
            position.tightenStop(position.getEntryPrice());
        }
        exposure.adjust(position.getSymbol(), position.getRemainingShares() * position.getEntryPrice(),
                position.getRemainingShares() * Math.abs(position.getEntryPrice() - position.getStopPrice()));
        log.info("partial_taken symbol={} level={} shares={} price={} pnl={} remaining={} stop={}",
                position.getSymbol(), order.getPartialLevel(), shares, fill.price(), pnl,
                position.getRemainingShares(), position.getStopPrice());

        if (position.getRemainingShares() <= 0) {
            closePosition(position, fill.price(), order.getSubmittedAt(), ExitReason.PARTIAL, false);
            return;
        }
        resizeStop(position);
        mutated(position.getSymbol());
    }

    /**
     * The protective stop filled without the engine asking for it.
     */
    private void onExternalStopFill(String symbol, FillEvent fill) {
        Position position = positions.get(symbol);
        stopOrders.remove(fill.orderId());
        if (position == null) {
            log.warn("external_fill_without_position symbol={} order={}", symbol, fill.orderId());
            return;
        }
        // any exit the engine had in flight is now redundant
        List<PendingOrder> inFlight = pendingOrders.values().stream()
                .filter(o -> symbol.equals(o.getSymbol()) && o.getPurpose() != OrderPurpose.ENTRY)
                .toList();
        for (PendingOrder o : inFlight) {
            pendingOrders.remove(o.getClientOrderId());
            try {
                broker.cancelOrder(o.getClientOrderId());
            } catch (BrokerException e) {
                log.error("cancel_failed symbol={} order={} err={}", symbol, o.getClientOrderId(), e.getMessage());
            }
        }
        position.setStopOrderId(null);
        ExitReason reason = position.isTrailing() ? ExitReason.TRAIL_STOP : ExitReason.STOP_HIT;
        Instant time = fill.time() != null ? fill.time() : Instant.EPOCH;
        log.info("external_stop_fill symbol={} order={} price={} reason={}", symbol, fill.orderId(), fill.price(), reason);
        closePosition(position, fill.price(), time, reason, true);
    }

    private void closePosition(Position position, double price, Instant time, ExitReason reason, boolean external) {
        String symbol = position.getSymbol();
        int shares = position.getRemainingShares();
        double legPnl = position.getSide().favourableMove(position.getEntryPrice(), price) * shares;
        double gross = position.getRealizedPnl() + legPnl;
        double fees = position.getFees() + commission(shares);

        ClosedTrade trade = ClosedTrade.builder()
                .id(sessionDate + "-" + position.getEntryOrderId())
                .sessionDate(sessionDate)
                .symbol(symbol)
                .side(position.getSide())
                .setupType(position.getSetupType())
                .pivotPrice(position.getPivotPrice())
                .entryPrice(position.getEntryPrice())
                .entryTime(position.getEntryTime())
                .exitPrice(price)
                .exitTime(time)
                .shares(position.getShares())
                .partials(new ArrayList<>(position.getPartialsTaken()))
                .grossPnl(gross)
                .fees(fees)
                .realizedPnl(gross - fees)
                .reason(reason)
                .durationSeconds(Duration.between(position.getEntryTime(), time).getSeconds())
                .external(external)
                .build();

        positions.remove(symbol);
        String stopId = position.getStopOrderId();
        if (stopId != null) {
            stopOrders.remove(stopId);
            try {
                broker.cancelOrder(stopId);
            } catch (BrokerException e) {
                log.error("stop_cancel_failed symbol={} order={} err={}", symbol, stopId, e.getMessage());
            }
        }
        exposure.release(symbol);
        ledger.add(trade);
        try {
            tradeSink.record(trade);
        } catch (RuntimeException e) {
            log.error("trade_sink_failed symbol={} trade={} err={}", symbol, trade.getId(), e.toString());
        }
        log.info("trade_closed symbol={} side={} reason={} external={} entry={} exit={} shares={} gross={} fees={} net={}",
                symbol, trade.getSide(), reason, external, trade.getEntryPrice(), price, trade.getShares(),
                String.format("%.2f", gross), String.format("%.2f", fees), String.format("%.2f", trade.getRealizedPnl()));
        mutated(symbol);
    }

    // ---------------------------------------------------------------- exits

    /**
     * Runs the exit rules for the symbol's position at {@code price}. Positions with an exit
     * order in flight or in BROKER_ERROR are skipped.
     */
    public ExitAction evaluate(String symbol, double price, Instant time) {
        Position position = positions.get(symbol);
        if (position == null || position.getStatus() != PositionStatus.OPEN || hasPendingExit(symbol)) {
            return ExitAction.none(OptionalDouble.empty());
        }
        position.observePrice(price);
        SetupThresholds thresholds = properties.thresholds(position.getSetupType());
        ExitAction action = exitRules.evaluate(position, price, time, thresholds);

        if (action.newStop().isPresent()) {
            double previous = position.getStopPrice();
            if (position.tightenStop(action.newStop().getAsDouble())) {
                position.setTrailing(true);
                log.info("stop_trailed symbol={} from={} to={} price={}", symbol,
                        String.format("%.4f", previous), String.format("%.4f", position.getStopPrice()), price);
                if (!resizeStop(position)) {
                    mutated(symbol);
                    return ExitAction.none(action.newStop());
                }
                mutated(symbol);
            }
        }

        switch (action.type()) {
            case PARTIAL -> {
                int shares = (int) Math.round(position.getShares() * action.fraction());
                if (shares <= 0 || shares >= position.getRemainingShares()) {
                    // too small to split; move on to the next level
                    log.info("partial_skipped symbol={} level={} computedShares={} remaining={}",
                            symbol, action.partialLevel(), shares, position.getRemainingShares());
                    position.setNextPartialLevel(action.partialLevel() + 1);
                    mutated(symbol);
                    return ExitAction.none(action.newStop());
                }
                submitExit(position, OrderPurpose.PARTIAL, ExitReason.PARTIAL, shares, action.partialLevel(), price, time);
            }
            case FULL -> submitExit(position, OrderPurpose.EXIT, action.reason(), position.getRemainingShares(),
                    -1, price, time);
            case NONE -> {
                // high and low water marks moved
                commit(symbol);
            }
        }
        return action;
    }

    private void submitExit(Position position, OrderPurpose purpose, ExitReason reason, int shares, int level,
                            double price, Instant time) {
        String symbol = position.getSymbol();
        String clientOrderId = nextOrderId(symbol, purpose == OrderPurpose.PARTIAL ? "PRT" : "EXT");
        pendingOrders.put(clientOrderId, PendingOrder.builder()
                .clientOrderId(clientOrderId)
                .symbol(symbol)
                .purpose(purpose)
                .side(position.getSide())
                .shares(shares)
                .referencePrice(price)
                .submittedAt(time)
                .reason(reason)
                .partialLevel(level)
                .build());
        if (purpose == OrderPurpose.EXIT) {
            position.setStatus(PositionStatus.PENDING_CLOSE);
        }
        log.info("exit_submitted symbol={} reason={} shares={} price={} order={}", symbol, reason, shares, price, clientOrderId);
        try {
            broker.submitOrder(new OrderRequest(clientOrderId, symbol, OrderAction.closing(position.getSide()),
                    shares, price));
        } catch (BrokerException e) {
            pendingOrders.remove(clientOrderId);
            position.setStatus(PositionStatus.BROKER_ERROR);
            log.error("exit_failed symbol={} reason={} order={} err={} status=BROKER_ERROR", symbol, reason,
                    clientOrderId, e.getMessage());
        }
        mutated(symbol);
    }

    /**
     * Pushes the current stop price and remaining size to the broker's resting stop.
     * Returns false, marking the position BROKER_ERROR, when the broker refuses.
     */
    private boolean resizeStop(Position position) {
        if (position.getStopOrderId() == null) {
            return true;
        }
        try {
            broker.modifyStop(position.getStopOrderId(), position.getRemainingShares(), position.getStopPrice());
            return true;
        } catch (BrokerException e) {
            position.setStatus(PositionStatus.BROKER_ERROR);
            log.error("stop_modify_failed symbol={} order={} err={} status=BROKER_ERROR",
                    position.getSymbol(), position.getStopOrderId(), e.getMessage());
            return false;
        }
    }

    // ---------------------------------------------------------------- committed state

    private void mutated(String symbol) {
        commit(symbol);
        mutationListener.onMutation(symbol);
    }

    private void commit(String symbol) {
        Position live = positions.get(symbol);
        if (live == null) {
            committedPositions.remove(symbol);
        } else {
            committedPositions.put(symbol, live.copy());
        }
        List<PendingOrder> pending = pendingOrders.values().stream()
                .filter(o -> symbol.equals(o.getSymbol()))
                .map(PendingOrder::copy)
                .toList();
        if (pending.isEmpty()) {
            committedPending.remove(symbol);
        } else {
            committedPending.put(symbol, pending);
        }
        String keyPrefix = symbol + "_";
        attemptCounts.forEach((key, count) -> {
            if (key.startsWith(keyPrefix)) {
                committedAttempts.put(key, count);
            }
        });
    }

    /**
     * Copies of every open position as of the end of its symbol's last mutation, by symbol.
     */
    public List<Position> committedPositions() {
        return committedPositions.values().stream()
                .sorted(Comparator.comparing(Position::getSymbol))
                .toList();
    }

    public List<PendingOrder> committedPendingOrders() {
        return committedPending.values().stream()
                .flatMap(List::stream)
                .sorted(Comparator.comparing(PendingOrder::getClientOrderId))
                .toList();
    }

    public Map<String, Integer> committedAttemptCounts() {
        return Map.copyOf(committedAttempts);
    }

    // ---------------------------------------------------------------- queries

    public Optional<Position> position(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public boolean hasOpenPosition(String symbol) {
        return positions.containsKey(symbol);
    }

    public boolean hasPendingExit(String symbol) {
        return pendingOrders.values().stream()
                .anyMatch(o -> symbol.equals(o.getSymbol()) && o.getPurpose() != OrderPurpose.ENTRY);
    }

    public boolean hasPendingEntry(String symbol) {
        return pendingOrders.values().stream()
                .anyMatch(o -> symbol.equals(o.getSymbol()) && o.getPurpose() == OrderPurpose.ENTRY);
    }

    public boolean isBrokerError(String symbol) {
        Position position = positions.get(symbol);
        return position != null && position.getStatus() == PositionStatus.BROKER_ERROR;
    }

    public int attemptsUsed(String pivotKey) {
        return attemptCounts.getOrDefault(pivotKey, 0);
    }

    public Map<String, Position> positions() {
        return Collections.unmodifiableMap(positions);
    }

    public Map<String, PendingOrder> pendingOrders() {
        return Collections.unmodifiableMap(pendingOrders);
    }

    public Map<String, Integer> attemptCounts() {
        return Collections.unmodifiableMap(attemptCounts);
    }

    public List<ClosedTrade> ledger() {
        synchronized (ledger) {
            return List.copyOf(ledger);
        }
    }

    public DailySummary dailySummary() {
        return DailySummary.of(sessionDate, ledger());
    }

    public double unrealizedPnl(String symbol, double price) {
        Position position = positions.get(symbol);
        return position == null ? 0.0 : position.unrealizedPnl(price);
    }

    // ---------------------------------------------------------------- session lifecycle

    /**
     * Clears all state for a new session date.
     */
    public void resetForSession(LocalDate date) {
        this.sessionDate = date;
        positions.clear();
        pendingOrders.clear();
        stopOrders.clear();
        attemptCounts.clear();
        committedPositions.clear();
        committedPending.clear();
        committedAttempts.clear();
        ledger.clear();
        exposure.clear();
        orderSequence.set(0);
    }

    /**
     * Re-installs persisted state after a restart. Order numbering continues past every
     * restored id so new client ids never collide with live ones.
     */
    public void restore(Collection<Position> restoredPositions, Map<String, Integer> restoredAttempts,
                        Collection<PendingOrder> restoredPending) {
        long maxSequence = 0;
        for (Position position : restoredPositions) {
            positions.put(position.getSymbol(), position);
            if (position.getStopOrderId() != null) {
                stopOrders.put(position.getStopOrderId(), position.getSymbol());
            }
            exposure.adjust(position.getSymbol(), position.getRemainingShares() * position.getEntryPrice(),
                    position.getRemainingShares() * Math.abs(position.getEntryPrice() - position.getStopPrice()));
            for (String id : position.getBrokerOrderIds()) {
                maxSequence = Math.max(maxSequence, sequenceOf(id));
            }
        }
        for (PendingOrder order : restoredPending) {
            pendingOrders.put(order.getClientOrderId(), order);
            maxSequence = Math.max(maxSequence, sequenceOf(order.getClientOrderId()));
        }
        attemptCounts.putAll(restoredAttempts);
        committedAttempts.putAll(restoredAttempts);
        restoredPositions.forEach(p -> commit(p.getSymbol()));
        restoredPending.forEach(o -> commit(o.getSymbol()));
        orderSequence.accumulateAndGet(maxSequence, Math::max);
    }

    /**
     * Forgets a position without trading it, used when the broker does not confirm it.
     */
    public void dropPosition(String symbol) {
        Position removed = positions.remove(symbol);
        if (removed != null && removed.getStopOrderId() != null) {
            stopOrders.remove(removed.getStopOrderId());
        }
        pendingOrders.values().removeIf(o -> symbol.equals(o.getSymbol()));
        exposure.release(symbol);
        commit(symbol);
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }

    private String nextOrderId(String symbol, String tag) {
        return symbol + "-" + tag + "-" + orderSequence.incrementAndGet();
    }

    private static long sequenceOf(String clientOrderId) {
        int dash = clientOrderId == null ? -1 : clientOrderId.lastIndexOf('-');
        if (dash < 0) {
            return 0;
        }
        try {
            return Long.parseLong(clientOrderId.substring(dash + 1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private double commission(int shares) {
        return properties.getAccount().getCommissionPerShare() * shares;
    }
}
