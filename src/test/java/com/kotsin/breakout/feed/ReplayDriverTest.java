package com.kotsin.breakout.feed;

import com.kotsin.breakout.config.EngineProperties;
import com.kotsin.breakout.engine.BreakoutEngineFactory;
import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.model.OrderFlowSample;
import com.kotsin.breakout.model.PivotLevel;
import com.kotsin.breakout.model.Side;
import com.kotsin.breakout.position.ClosedTrade;
import com.kotsin.breakout.position.ExitReason;
import com.kotsin.breakout.support.Bars;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplayDriverTest {

    private static final LocalDate SESSION = LocalDate.of(2024, 3, 15);
    private static final Instant START = Bars.SESSION_OPEN.plusSeconds(15 * 60);

    private ReplayDriver driver;
    private List<PivotLevel> pivots;
    private List<Bar> bars;
    private List<OrderFlowSample> samples;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        properties.setBarIntervalSeconds(60);
        driver = new ReplayDriver(new BreakoutEngineFactory(properties));

        pivots = List.of(
                PivotLevel.builder().symbol("AAPL").pivotPrice(100.0).sideBias(Side.LONG).score(1).build(),
                PivotLevel.builder().symbol("MSFT").pivotPrice(420.0).sideBias(Side.LONG).score(1).build());

        bars = new ArrayList<>();
        double[][] aapl = {
                {99.5, 99.5, 100}, {99.5, 99.5, 100}, {99.5, 99.5, 100}, {99.5, 99.5, 100}, {99.5, 99.5, 100},
                {99.9, 100.5, 300},
                {100.5, 101.0, 300},
                {100.5, 99.5, 400},
                {99.5, 99.4, 100}
        };
        for (int i = 0; i < aapl.length; i++) {
            bars.add(Bars.of("AAPL", START.plusSeconds(i * 60L), aapl[i][0], aapl[i][1], (long) aapl[i][2]));
            bars.add(Bars.flat("MSFT", START.plusSeconds(i * 60L), 415.0, 200));
        }
        // shuffled input must not matter
        Collections.reverse(bars);

        samples = List.of(
                new OrderFlowSample("MSFT", START.plusSeconds(10), -5),
                new OrderFlowSample("MSFT", START.plusSeconds(40), -8),
                new OrderFlowSample("MSFT", START.plusSeconds(70), 150));
    }

    @Test
    @DisplayName("A session replay produces the breakout trade and its stop-out")
    void replayProducesTrade() {
        ReplayResult result = driver.run(SESSION, pivots, bars, samples);

        assertEquals(1, result.trades().size());
        ClosedTrade trade = result.trades().get(0);
        assertEquals("AAPL", trade.getSymbol());
        assertEquals(101.0, trade.getEntryPrice());
        assertEquals(100.0, trade.getExitPrice());
        assertEquals(ExitReason.STOP_HIT, trade.getReason());
        assertTrue(trade.isExternal());
        assertTrue(result.openPositions().isEmpty());

        assertEquals(18, result.ticksProcessed());
        assertEquals(0, result.ticksRejected());
        assertEquals(2, result.samplesDropped());
        assertEquals(1, result.summary().trades());
        assertTrue(result.decisions().stream().anyMatch(d -> "ENTER".equals(d.action())));
    }

    @Test
    @DisplayName("Replaying the same session twice gives identical results")
    void replayIsDeterministic() {
        ReplayResult first = driver.run(SESSION, pivots, bars, samples);
        ReplayResult second = driver.run(SESSION, pivots, bars, samples);
        assertEquals(first, second);
    }

    @Test
    @DisplayName("Replay ignores the live order rate limit")
    void replayIsNotRateLimited() {
        EngineProperties slow = new EngineProperties();
        slow.setBarIntervalSeconds(60);
        slow.getBroker().setOrdersPerSecond(0.1);
        slow.getBroker().setPermitTimeoutMillis(0);
        ReplayDriver slowDriver = new ReplayDriver(new BreakoutEngineFactory(slow));

        ReplayResult result = slowDriver.run(SESSION, pivots, bars, samples);

        assertEquals(1, result.trades().size());
        assertEquals(ExitReason.STOP_HIT, result.trades().get(0).getReason());
        assertEquals(result.trades(), driver.run(SESSION, pivots, bars, samples).trades());
    }
}
