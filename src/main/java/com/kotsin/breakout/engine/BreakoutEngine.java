package com.kotsin.breakout.engine;

import com.kotsin.breakout.audit.DecisionRecord;
import com.kotsin.breakout.audit.DecisionRecordSink;
import com.kotsin.breakout.broker.BrokerGateway;
import com.kotsin.breakout.broker.BrokerHolding;
import com.kotsin.breakout.broker.FillEvent;
import com.kotsin.breakout.buffer.BarBuffer;
import com.kotsin.breakout.buffer.ConfirmationTiming;
import com.kotsin.breakout.config.EngineProperties;
import com.kotsin.breakout.config.SetupThresholds;
import com.kotsin.breakout.entry.EntryDecision;
import com.kotsin.breakout.entry.EntryEligibility;
import com.kotsin.breakout.entry.EntryStateMachine;
import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.model.MarketTick;
import com.kotsin.breakout.model.PivotLevel;
import com.kotsin.breakout.model.SetupType;
import com.kotsin.breakout.position.ExitAction;
import com.kotsin.breakout.position.OrderPurpose;
import com.kotsin.breakout.position.PendingOrder;
import com.kotsin.breakout.position.Position;
import com.kotsin.breakout.position.PositionManager;
import com.kotsin.breakout.risk.SizingResult;
import com.kotsin.breakout.session.ReconciliationReport;
import com.kotsin.breakout.session.SessionSnapshot;
import com.kotsin.breakout.session.SessionStateStore;
import com.kotsin.breakout.state.StateTracker;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Per-symbol orchestration of the breakout strategy.
 *
 * <p>For each tick: append the bar, run the exit rules on any open position, then, if the symbol
 * is eligible, run the entry state machine and hand an ENTER to the position manager. The same
 * instance logic serves live and replay drivers; only the broker, the snapshot repository and the
 * sinks differ. Decisions use bar event time only.
 *
 * <p>Ticks and fills for one symbol are serialised by that symbol's lock; symbols run in parallel.
 * Any failure inside one symbol's processing is logged and contained there.
 */
@Slf4j
public class BreakoutEngine {

    private final EngineProperties properties;
    private final PositionManager positionManager;
    private final SessionStateStore stateStore;
    private final BrokerGateway broker;
    private final DecisionRecordSink decisionSink;
    private final SymbolArena arena = new SymbolArena();
    private final Set<String> haltedSymbols = ConcurrentHashMap.newKeySet();
    // fills for symbols outside the watchlist
    private final ReentrantLock orphanFillLock = new ReentrantLock();

    private final AtomicLong ticksProcessed = new AtomicLong();
    private final AtomicLong ticksRejected = new AtomicLong();

    private volatile ConfirmationTiming timing;
    private volatile boolean entriesEnabled;
    private volatile boolean operatorEntriesEnabled = true;
    private volatile LocalDate sessionDate;

    public BreakoutEngine(EngineProperties properties, PositionManager positionManager,
                          SessionStateStore stateStore, BrokerGateway broker, DecisionRecordSink decisionSink) {
        properties.validate();
        this.properties = properties;
        this.positionManager = positionManager;
        this.stateStore = stateStore;
        this.broker = broker;
        this.decisionSink = decisionSink;
        ConfirmationTiming initial = ConfirmationTiming.of(properties.getBarIntervalSeconds(),
                properties.getConfirmationIntervalSeconds());
        checkCapacity(initial);
        this.timing = initial;
        stateStore.bind(this::buildSnapshot);
        positionManager.setMutationListener(symbol -> stateStore.snapshot());
    }

    // ---------------------------------------------------------------- session lifecycle

    /**
     * Starts a session for {@code date} with the scanner's pivots. Loads any snapshot for the
     * date, reconciles it with broker holdings and only then enables entries. Symbols that do
     * not reconcile stay halted; their persisted positions are not resumed.
     */
    public ReconciliationReport startSession(LocalDate date, List<PivotLevel> pivots) {
        entriesEnabled = false;
        sessionDate = date;
        haltedSymbols.clear();
        positionManager.resetForSession(date);
        arena.reset(pivots, properties.getScanner(), this::newContext);
        log.info("session_starting date={} symbols={} timing={}", date, arena.size(), timing);

        SessionSnapshot snapshot = stateStore.load(date)
                .orElseGet(() -> SessionSnapshot.builder().sessionDate(date).build());
        List<BrokerHolding> holdings = broker.currentHoldings();
        ReconciliationReport report = stateStore.reconcile(snapshot, holdings);

        Set<String> halted = report.haltedSymbols();
        Set<String> resumedSymbols = report.resumed().stream().map(Position::getSymbol).collect(Collectors.toSet());
        List<PendingOrder> pending = snapshot.getPendingOrders().stream()
                .filter(o -> !halted.contains(o.getSymbol()))
                .filter(o -> resumedSymbols.contains(o.getSymbol()) || o.getPurpose() == OrderPurpose.ENTRY)
                .toList();
        positionManager.restore(report.resumed(), snapshot.getAttemptCounts(), pending);
        // resumed positions need ticks even if today's scan dropped their symbol
        for (Position p : report.resumed()) {
            arena.addIfAbsent(PivotLevel.builder()
                    .symbol(p.getSymbol())
                    .pivotPrice(p.getPivotPrice())
                    .sideBias(p.getSide())
                    .setupType(p.getSetupType())
                    .build(), this::newContext);
        }
        haltedSymbols.addAll(halted);
        haltedSymbols.addAll(snapshot.getHaltedSymbols());

        snapshot.getLastLogicalPositions().forEach((symbol, last) ->
                arena.get(symbol).ifPresent(ctx -> {
                    ctx.buffer().resumeAt(last + 1);
                    ctx.setLastLogicalPosition(last);
                }));
        snapshot.getLastOpenTimes().forEach((symbol, openTime) ->
                arena.get(symbol).ifPresent(ctx -> ctx.setLastOpenTime(openTime)));

        entriesEnabled = true;
        stateStore.snapshot();
        log.info("session_started date={} resumedPositions={} halted={} clean={}",
                date, report.resumed().size(), haltedSymbols, report.isClean());
        return report;
    }

    private SymbolContext newContext(PivotLevel pivot) {
        SetupThresholds thresholds = properties.thresholds(pivot.getSetupType());
        BarBuffer buffer = new BarBuffer(properties.getBufferCapacity());
        StateTracker tracker = new StateTracker(pivot.getSymbol());
        EntryStateMachine machine = new EntryStateMachine(pivot, thresholds, tracker, buffer, timing);
        return new SymbolContext(pivot, buffer, tracker, machine);
    }

    /**
     * Stops new entries, writes the final snapshot, then closes the broker connection.
     */
    public void shutdown() {
        entriesEnabled = false;
        stateStore.flush();
        broker.close();
        log.info("engine_shutdown date={} ticks={} rejected={} summary={}",
                sessionDate, ticksProcessed.get(), ticksRejected.get(), positionManager.dailySummary());
    }

    // ---------------------------------------------------------------- ticks

    public TickResult onTick(MarketTick tick) {
        Bar bar = tick.bar();
        String symbol = tick.symbol();
        try {
            if (bar == null) {
                throw new DataException("Tick has no bar");
            }
            bar.validate();
            if (tick.orderFlow() != null) {
                tick.orderFlow().validate();
                if (!tick.orderFlow().symbol().equals(symbol)) {
                    throw new DataException("Order-flow sample for " + tick.orderFlow().symbol()
                            + " attached to a " + symbol + " bar");
                }
            }
            if (!(tick.currentPrice() > 0) || !Double.isFinite(tick.currentPrice())) {
                throw new DataException("Tick for " + symbol + " has invalid price " + tick.currentPrice());
            }
        } catch (DataException e) {
            return reject(symbol, e);
        }

        SymbolContext ctx = arena.get(symbol).orElse(null);
        if (ctx == null) {
            return reject(symbol, new DataException("Symbol " + symbol + " is not on the session watchlist"));
        }

        ctx.lock().lock();
        try {
            if (ctx.lastOpenTime() != null && !bar.openTime().isAfter(ctx.lastOpenTime())) {
                throw new DataException("Out-of-order bar for " + symbol + ": " + bar.openTime()
                        + " not after " + ctx.lastOpenTime());
            }
            long position = ctx.buffer().append(bar);
            ctx.accepted(bar.openTime(), position);
            ticksProcessed.incrementAndGet();
            return process(ctx, tick, position);
        } catch (DataException e) {
            return reject(symbol, e);
        } catch (RuntimeException e) {
            ticksRejected.incrementAndGet();
            log.error("tick_failed symbol={} time={} err={}", symbol, bar.openTime(), e.toString(), e);
            return TickResult.rejected(symbol, e.toString());
        } finally {
            ctx.lock().unlock();
        }
    }

    private TickResult process(SymbolContext ctx, MarketTick tick, long logicalPosition) {
        String symbol = ctx.symbol();
        Bar bar = tick.bar();
        Instant time = bar.openTime();
        double price = tick.currentPrice();

        ExitAction exit = positionManager.evaluate(symbol, price, time);

        EntryEligibility eligibility = eligibility(ctx, time);
        EntryDecision decision = ctx.machine().evaluate(bar, logicalPosition, price, tick.orderFlow(), eligibility);
        SizingResult sizing = null;
        if (decision.isEnter()) {
            PositionManager.EntryOutcome outcome = positionManager.requestEntry(ctx.pivot(), decision, logicalPosition, time);
            sizing = outcome.sizing();
            if (!outcome.submitted()) {
                decision = decision.rejectedAs(outcome.reason());
            }
        }
        if (decision.isNotable()) {
            publish(DecisionRecord.of(symbol, time, logicalPosition, decision, sizing));
        }
        return new TickResult(symbol, logicalPosition, decision, exit, null);
    }

    private EntryEligibility eligibility(SymbolContext ctx, Instant time) {
        String symbol = ctx.symbol();
        LocalTime local = time.atZone(properties.zone()).toLocalTime();
        boolean inWindow = !local.isBefore(properties.getEntryWindowStart()) && local.isBefore(properties.getEntryWindowEnd());
        return new EntryEligibility(
                entriesEnabled && operatorEntriesEnabled,
                haltedSymbols.contains(symbol) || positionManager.isBrokerError(symbol),
                positionManager.hasPendingExit(symbol),
                positionManager.hasOpenPosition(symbol) || positionManager.hasPendingEntry(symbol),
                inWindow,
                positionManager.attemptsUsed(ctx.pivot().pivotKey()),
                properties.getMaxAttemptsPerPivot());
    }

    private void publish(DecisionRecord record) {
        try {
            decisionSink.publish(record);
        } catch (RuntimeException e) {
            log.error("decision_sink_failed symbol={} err={}", record.symbol(), e.toString());
        }
    }

    private TickResult reject(String symbol, DataException e) {
        ticksRejected.incrementAndGet();
        log.warn("tick_rejected symbol={} err={}", symbol, e.getMessage());
        return TickResult.rejected(symbol, e.getMessage());
    }

    // ---------------------------------------------------------------- fills

    /**
     * Applies a broker fill under the symbol's lock.
     */
    public void onFill(FillEvent fill) {
        ReentrantLock lock = arena.get(fill.symbol()).map(SymbolContext::lock).orElse(orphanFillLock);
        lock.lock();
        try {
            positionManager.onFill(fill);
        } catch (RuntimeException e) {
            log.error("fill_failed symbol={} order={} err={}", fill.symbol(), fill.orderId(), e.toString(), e);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- operator controls

    /**
     * Switches raw bar granularity. Every lookback measured in confirmation candles or seconds is
     * re-derived from the new timing; the buffer capacity must still cover the longest one.
     */
    public void changeBarInterval(int barIntervalSeconds) {
        ConfirmationTiming next = timing.withBarInterval(barIntervalSeconds);
        checkCapacity(next);
        timing = next;
        for (SymbolContext ctx : arena.contexts()) {
            ctx.lock().lock();
            try {
                ctx.machine().updateTiming(next);
            } finally {
                ctx.lock().unlock();
            }
        }
        log.info("bar_interval_changed timing={}", next);
    }

    public void haltSymbol(String symbol, String reason) {
        haltedSymbols.add(symbol);
        log.warn("symbol_halted symbol={} reason={}", symbol, reason);
        stateStore.snapshot();
    }

    public void setEntriesEnabled(boolean enabled) {
        operatorEntriesEnabled = enabled;
        log.info("entries_enabled={}", enabled);
    }

    private void checkCapacity(ConfirmationTiming candidate) {
        long longest = 0;
        for (SetupType type : SetupType.values()) {
            SetupThresholds t = properties.thresholds(type);
            long candleAndVolume = candidate.barsPerConfirmationInterval()
                    + candidate.barsForCandles(t.getVolumeLookbackCandles());
            long freshness = candidate.barsFor(t.getMaxBreakoutAgeSeconds()) + candidate.barsPerConfirmationInterval();
            longest = Math.max(longest, Math.max(candleAndVolume, freshness));
        }
        if (longest >= properties.getBufferCapacity()) {
            throw new IllegalStateException("engine.buffer-capacity " + properties.getBufferCapacity()
                    + " cannot hold the longest lookback of " + longest + " bars at " + candidate);
        }
    }

    // ---------------------------------------------------------------- state

    SessionSnapshot buildSnapshot() {
        Map<String, Long> lastPositions = new HashMap<>();
        Map<String, Instant> lastOpenTimes = new HashMap<>();
        for (SymbolContext ctx : arena.contexts()) {
            Instant openTime = ctx.lastOpenTime();
            if (openTime != null) {
                lastOpenTimes.put(ctx.symbol(), openTime);
            }
            if (ctx.lastLogicalPosition() >= 0) {
                lastPositions.put(ctx.symbol(), ctx.lastLogicalPosition());
            }
        }
        // committed copies only: another symbol's thread may be mid-change on the live objects
        return SessionSnapshot.builder()
                .sessionDate(sessionDate)
                .savedAt(Instant.now())
                .positions(new ArrayList<>(positionManager.committedPositions()))
                .attemptCounts(new HashMap<>(positionManager.committedAttemptCounts()))
                .lastLogicalPositions(lastPositions)
                .lastOpenTimes(lastOpenTimes)
                .pendingOrders(new ArrayList<>(positionManager.committedPendingOrders()))
                .haltedSymbols(new TreeSet<>(haltedSymbols))
                .build();
    }

    public PositionManager positionManager() {
        return positionManager;
    }

    public ConfirmationTiming timing() {
        return timing;
    }

    public boolean isHalted(String symbol) {
        return haltedSymbols.contains(symbol);
    }

    public boolean isEntriesEnabled() {
        return entriesEnabled && operatorEntriesEnabled;
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }

    public SymbolContext context(String symbol) {
        return arena.get(symbol).orElseThrow(() -> new DataException("Symbol " + symbol + " is not on the session watchlist"));
    }

    public long getTicksProcessed() {
        return ticksProcessed.get();
    }

    public long getTicksRejected() {
        return ticksRejected.get();
    }
}
