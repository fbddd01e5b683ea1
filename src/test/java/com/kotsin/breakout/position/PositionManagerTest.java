package com.kotsin.breakout.position;

import com.github.benmanes.caffeine.cache.Cache;
import com.kotsin.breakout.broker.BrokerGateway;
import com.kotsin.breakout.broker.FillEvent;
import com.kotsin.breakout.broker.OrderAction;
import com.kotsin.breakout.broker.PaperBrokerClient;
import com.kotsin.breakout.config.EngineProperties;
import com.kotsin.breakout.config.SetupThresholds;
import com.kotsin.breakout.engine.BreakoutEngineFactory;
import com.kotsin.breakout.entry.ConfirmationPath;
import com.kotsin.breakout.entry.EntryDecision;
import com.kotsin.breakout.entry.RejectReason;
import com.kotsin.breakout.model.PivotLevel;
import com.kotsin.breakout.model.SetupType;
import com.kotsin.breakout.model.Side;
import com.kotsin.breakout.risk.AccountExposureAggregator;
import com.kotsin.breakout.risk.RiskSizer;
import com.kotsin.breakout.support.Bars;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PositionManagerTest {

    private static final String SYMBOL = "AAPL";
    private static final LocalDate SESSION = LocalDate.of(2024, 3, 15);
    // 09:45 New York
    private static final Instant ENTRY_TIME = Bars.SESSION_OPEN.plusSeconds(15 * 60);

    private final PivotLevel pivot = PivotLevel.builder()
            .symbol(SYMBOL).pivotPrice(100.0).sideBias(Side.LONG).setupType(SetupType.MOMENTUM).build();

    private EngineProperties properties;
    private PaperBrokerClient paper;
    private AccountExposureAggregator exposure;
    private Cache<String, Boolean> fillCache;
    private List<ClosedTrade> sunk;
    private PositionManager manager;

    @BeforeEach
    void setUp() {
        properties = new EngineProperties();
        build();
    }

    private void build() {
        paper = new PaperBrokerClient();
        exposure = new AccountExposureAggregator(properties.getAccount().getMaxTotalExposure());
        fillCache = BreakoutEngineFactory.newFillCache();
        sunk = new ArrayList<>();
        manager = new PositionManager(properties, new RiskSizer(), exposure,
                new BrokerGateway(paper, properties.getBroker(), ms -> { }), fillCache, sunk::add);
        paper.setFillListener(manager::onFill);
        manager.resetForSession(SESSION);
    }

    private void withoutPartials() {
        properties.getSetups().put(SetupType.MOMENTUM, SetupThresholds.builder().partials(List.of()).build());
        build();
    }

    private PositionManager.EntryOutcome enter(double price) {
        paper.markPrice(SYMBOL, price, ENTRY_TIME);
        EntryDecision decision = EntryDecision.enter(Side.LONG, price, ConfirmationPath.MOMENTUM, Map.of());
        return manager.requestEntry(pivot, decision, 40, ENTRY_TIME);
    }

    private ExitAction at(double price, long secondsAfterEntry) {
        Instant time = ENTRY_TIME.plusSeconds(secondsAfterEntry);
        paper.markPrice(SYMBOL, price, time);
        return manager.evaluate(SYMBOL, price, time);
    }

    private Position position() {
        return manager.position(SYMBOL).orElseThrow();
    }

    @Nested
    @DisplayName("Entries")
    class Entries {

        @Test
        @DisplayName("A confirmed entry is sized, filled and protected by a resting stop at the pivot")
        void entryOpensPosition() {
            PositionManager.EntryOutcome outcome = enter(100.5);

            assertTrue(outcome.submitted());
            assertEquals("AAPL-ENT-1", outcome.clientOrderId());
            assertEquals(199, outcome.sizing().shares());

            Position p = position();
            assertEquals(199, p.getRemainingShares());
            assertEquals(100.5, p.getEntryPrice());
            assertEquals(100.0, p.getStopPrice());
            assertEquals(ENTRY_TIME, p.getEntryTime());
            assertEquals("AAPL-STP-2", p.getStopOrderId());
            assertTrue(paper.hasRestingStop("AAPL-STP-2"));
            assertEquals(1, manager.attemptsUsed(pivot.pivotKey()));
            assertFalse(manager.hasPendingEntry(SYMBOL));
            assertEquals(199 * 100.5, exposure.totalExposure(), 1e-6);
        }

        @Test
        @DisplayName("An entry price on the wrong side of the stop is a sizing rejection")
        void stopNotBehindEntry() {
            PositionManager.EntryOutcome outcome = enter(99.9);
            assertFalse(outcome.submitted());
            assertEquals(RejectReason.SIZING_REJECTED, outcome.reason());
            assertFalse(manager.hasOpenPosition(SYMBOL));
        }

        @Test
        @DisplayName("Entries beyond the account exposure limit are refused")
        void exposureLimit() {
            properties.getAccount().setMaxTotalExposure(10_000);
            build();
            PositionManager.EntryOutcome outcome = enter(100.5);
            assertEquals(RejectReason.EXPOSURE_LIMIT, outcome.reason());
            assertTrue(manager.pendingOrders().isEmpty());
        }

        @Test
        @DisplayName("A refused entry order releases its exposure and leaves nothing pending")
        void brokerFailureOnEntry() {
            paper.failNextSubmissions(1, false);
            PositionManager.EntryOutcome outcome = enter(100.5);

            assertEquals(RejectReason.BROKER_FAILURE, outcome.reason());
            assertEquals(0, exposure.totalExposure(), 1e-9);
            assertTrue(manager.pendingOrders().isEmpty());
            assertEquals(0, manager.attemptsUsed(pivot.pivotKey()));
        }
    }

    @Nested
    @DisplayName("Exits")
    class Exits {

        @Test
        @DisplayName("A stop hit without trailing closes as STOP_HIT")
        void stopHit() {
            enter(100.5);
            ExitAction action = at(99.9, 60);

            assertEquals(ExitReason.STOP_HIT, action.reason());
            assertFalse(manager.hasOpenPosition(SYMBOL));
            ClosedTrade trade = manager.ledger().get(0);
            assertEquals(ExitReason.STOP_HIT, trade.getReason());
            assertEquals(-0.6 * 199, trade.getGrossPnl(), 1e-6);
            assertFalse(trade.isWinner());
            assertFalse(paper.hasRestingStop("AAPL-STP-2"));
            assertEquals(0, exposure.totalExposure(), 1e-9);
            assertEquals(List.of(trade), sunk);
        }

        @Test
        @DisplayName("No progress inside the stall window exits the trade")
        void stallExit() {
            enter(100.5);
            assertFalse(at(100.55, 5 * 60).isExit());
            ExitAction action = at(100.55, 8 * 60);

            assertEquals(ExitReason.STALL_EXIT, action.reason());
            assertEquals(ExitReason.STALL_EXIT, manager.ledger().get(0).getReason());
        }

        @Test
        @DisplayName("A partial exit moves the stop to breakeven and suppresses the stall rule")
        void partialSuppressesStall() {
            enter(100.5);
            ExitAction partial = at(100.8, 60);

            assertEquals(ExitAction.Type.PARTIAL, partial.type());
            Position p = position();
            assertEquals(99, p.getRemainingShares());
            assertEquals(1, p.getNextPartialLevel());
            assertEquals(100.5, p.getStopPrice());
            assertEquals(100.5, paper.restingStopPrice("AAPL-STP-2"));
            assertEquals(30.0, p.getRealizedPnl(), 1e-6);

            ExitAction later = at(100.55, 10 * 60);
            assertFalse(later.isExit());
            assertTrue(manager.hasOpenPosition(SYMBOL));
        }

        @Test
        @DisplayName("Trailing tightens the stop, never loosens it, and a hit closes as TRAIL_STOP")
        void trailingThenStop() {
            withoutPartials();
            enter(100.5);

            at(101.2, 60);
            Position p = position();
            assertTrue(p.isTrailing());
            double trailed = p.getStopPrice();
            assertEquals(101.2 * 0.99, trailed, 1e-9);
            assertEquals(trailed, paper.restingStopPrice("AAPL-STP-2"), 1e-9);

            at(100.9, 120);
            assertEquals(trailed, position().getStopPrice(), 1e-9);

            ExitAction action = at(100.1, 180);
            assertEquals(ExitReason.TRAIL_STOP, action.reason());
            assertEquals(ExitReason.TRAIL_STOP, manager.ledger().get(0).getReason());
        }

        @Test
        @DisplayName("Positions still open at the flatten time close as EOD_CLOSE")
        void endOfDay() {
            enter(100.5);
            // 15:55 New York
            ExitAction action = at(100.6, 6 * 3600 + 10 * 60);
            assertEquals(ExitReason.EOD_CLOSE, action.reason());
        }

        @Test
        @DisplayName("A broker-triggered stop closes the position as an external STOP_HIT")
        void externalStopFill() {
            enter(100.5);
            paper.onBar(Bars.of(SYMBOL, ENTRY_TIME.plusSeconds(60), 100.2, 99.6, 500));

            assertFalse(manager.hasOpenPosition(SYMBOL));
            ClosedTrade trade = manager.ledger().get(0);
            assertTrue(trade.isExternal());
            assertEquals(ExitReason.STOP_HIT, trade.getReason());
            assertEquals(100.0, trade.getExitPrice());
        }

        @Test
        @DisplayName("A refused exit order marks the position BROKER_ERROR and stops evaluating it")
        void brokerFailureOnExit() {
            enter(100.5);
            paper.failNextSubmissions(3, true);
            at(99.9, 60);

            assertTrue(manager.isBrokerError(SYMBOL));
            assertTrue(manager.hasOpenPosition(SYMBOL));
            assertFalse(at(99.0, 120).isExit());
        }
    }

    @Nested
    @DisplayName("Committed state")
    class CommittedState {

        @Test
        @DisplayName("Committed copies follow each completed mutation")
        void followsMutations() {
            enter(100.5);
            at(100.8, 60);

            Position committed = manager.committedPositions().get(0);
            assertEquals(99, committed.getRemainingShares());
            assertEquals(1, committed.getPartialsTaken().size());
            assertEquals(100.5, committed.getStopPrice());
            assertEquals(Map.of(pivot.pivotKey(), 1), manager.committedAttemptCounts());

            at(100.4, 120);
            assertTrue(manager.committedPositions().isEmpty());
            assertTrue(manager.committedPendingOrders().isEmpty());
        }

        @Test
        @DisplayName("A change still in progress on the live position does not reach the committed copy")
        void isolatedFromLivePosition() {
            enter(100.5);
            at(100.8, 60);

            Position live = position();
            live.getPartialsTaken().add(new PartialExit(2, 0.25, 50, 101.0, ENTRY_TIME.plusSeconds(90), 25.0));
            live.setRemainingShares(49);
            live.getBrokerOrderIds().add("AAPL-PTL-9");

            Position committed = manager.committedPositions().get(0);
            assertNotSame(live, committed);
            assertEquals(1, committed.getPartialsTaken().size());
            assertEquals(99, committed.getRemainingShares());
            assertFalse(committed.getBrokerOrderIds().contains("AAPL-PTL-9"));
        }

        @Test
        @DisplayName("Restored and dropped positions are committed immediately")
        void restoreAndDrop() {
            Position restored = Position.builder()
                    .symbol("MSFT").side(Side.LONG).setupType(SetupType.MOMENTUM)
                    .pivotKey("MSFT_400.00").pivotPrice(400).entryPrice(401).entryTime(ENTRY_TIME)
                    .entryOrderId("MSFT-ENT-7").shares(40).remainingShares(40)
                    .stopPrice(400).initialStopPrice(400).stopOrderId("MSFT-STP-8")
                    .highestPrice(401).lowestPrice(401)
                    .brokerOrderIds(new ArrayList<>(List.of("MSFT-ENT-7", "MSFT-STP-8")))
                    .build();
            manager.restore(List.of(restored), Map.of("MSFT_400.00", 1), List.of());

            assertEquals(List.of("MSFT"), manager.committedPositions().stream().map(Position::getSymbol).toList());
            assertEquals(Map.of("MSFT_400.00", 1), manager.committedAttemptCounts());

            manager.dropPosition("MSFT");
            assertTrue(manager.committedPositions().isEmpty());
        }
    }

    @Test
    @DisplayName("A fill delivered twice is applied once")
    void duplicateFillIgnored() {
        enter(100.5);
        FillEvent stopFill = new FillEvent("X-1", "AAPL-STP-2", SYMBOL, OrderAction.SELL, 199, 100.0,
                ENTRY_TIME.plusSeconds(60));
        manager.onFill(stopFill);
        manager.onFill(stopFill);

        assertEquals(1, manager.ledger().size());
        assertEquals(Boolean.TRUE, fillCache.getIfPresent("X-1"));
    }

    @Test
    @DisplayName("Restored state keeps attempts and numbers new orders past every restored id")
    void restoreContinuesSequence() {
        Position restored = Position.builder()
                .symbol("MSFT").side(Side.LONG).setupType(SetupType.MOMENTUM)
                .pivotKey("MSFT_400.00").pivotPrice(400).entryPrice(401).entryTime(ENTRY_TIME)
                .entryOrderId("MSFT-ENT-7").shares(40).remainingShares(40)
                .stopPrice(400).initialStopPrice(400).stopOrderId("MSFT-STP-8")
                .highestPrice(401).lowestPrice(401)
                .brokerOrderIds(new ArrayList<>(List.of("MSFT-ENT-7", "MSFT-STP-8")))
                .build();
        manager.restore(List.of(restored), Map.of("MSFT_400.00", 1), List.of());

        assertEquals(1, manager.attemptsUsed("MSFT_400.00"));
        assertEquals(40 * 401.0, exposure.totalExposure(), 1e-9);
        assertEquals("AAPL-ENT-9", enter(100.5).clientOrderId());
    }

    @Test
    @DisplayName("Daily summary aggregates the session ledger")
    void dailySummary() {
        enter(100.5);
        at(99.9, 60);
        DailySummary summary = manager.dailySummary();

        assertEquals(SESSION, summary.sessionDate());
        assertEquals(1, summary.trades());
        assertEquals(0, summary.winners());
        assertEquals(1, summary.losers());
        assertTrue(summary.netPnl() < summary.grossPnl());
    }
}
