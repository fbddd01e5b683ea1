package com.kotsin.breakout.engine;

import com.kotsin.breakout.buffer.BarBuffer;
import com.kotsin.breakout.buffer.ConfirmationTiming;
import com.kotsin.breakout.config.EngineProperties;
import com.kotsin.breakout.config.SetupThresholds;
import com.kotsin.breakout.entry.EntryStateMachine;
import com.kotsin.breakout.model.PivotLevel;
import com.kotsin.breakout.model.Side;
import com.kotsin.breakout.state.StateTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolArenaTest {

    private static final EngineProperties.Scanner ALL = new EngineProperties.Scanner();

    private static SymbolContext context(PivotLevel pivot) {
        BarBuffer buffer = new BarBuffer(16);
        StateTracker tracker = new StateTracker(pivot.getSymbol());
        return new SymbolContext(pivot, buffer, tracker, new EntryStateMachine(pivot, SetupThresholds.builder().build(),
                tracker, buffer, ConfirmationTiming.of(60, 60)));
    }

    private static PivotLevel pivot(String symbol, double price, double score) {
        return PivotLevel.builder().symbol(symbol).pivotPrice(price).sideBias(Side.LONG).score(score).build();
    }

    @Test
    @DisplayName("Duplicate pivots for a symbol keep the highest score")
    void highestScoreWins() {
        SymbolArena arena = new SymbolArena();
        arena.reset(List.of(pivot("AAPL", 100, 1.0), pivot("AAPL", 105, 3.0), pivot("MSFT", 420, 2.0)),
                ALL, SymbolArenaTest::context);

        assertEquals(2, arena.size());
        assertEquals(105.0, arena.get("AAPL").orElseThrow().pivot().getPivotPrice());
    }

    @Test
    @DisplayName("A new session replaces every context and addIfAbsent keeps existing ones")
    void resetAndAdd() {
        SymbolArena arena = new SymbolArena();
        arena.reset(List.of(pivot("AAPL", 100, 1.0)), ALL, SymbolArenaTest::context);
        SymbolContext original = arena.get("AAPL").orElseThrow();

        assertSame(original, arena.addIfAbsent(pivot("AAPL", 200, 9.0), SymbolArenaTest::context));
        arena.addIfAbsent(pivot("TSLA", 170, 0), SymbolArenaTest::context);
        assertEquals(2, arena.size());

        arena.reset(List.of(pivot("NVDA", 800, 1.0)), ALL, SymbolArenaTest::context);
        assertTrue(arena.get("AAPL").isEmpty());
        assertTrue(arena.get("NVDA").isPresent());
    }

    @Test
    @DisplayName("Pivots below the score or risk/reward floor are not watched")
    void scannerFloorsFilterPivots() {
        EngineProperties.Scanner scanner = new EngineProperties.Scanner();
        scanner.setMinScore(2.0);
        scanner.setMinRiskReward(1.5);
        PivotLevel lowScore = PivotLevel.builder().symbol("AAPL").pivotPrice(100).sideBias(Side.LONG)
                .score(1.0).riskReward(3.0).build();
        PivotLevel lowReward = PivotLevel.builder().symbol("MSFT").pivotPrice(420).sideBias(Side.LONG)
                .score(5.0).riskReward(1.0).build();
        PivotLevel admitted = PivotLevel.builder().symbol("NVDA").pivotPrice(800).sideBias(Side.LONG)
                .score(2.0).riskReward(1.5).build();

        SymbolArena arena = new SymbolArena();
        arena.reset(List.of(lowScore, lowReward, admitted), scanner, SymbolArenaTest::context);

        assertEquals(1, arena.size());
        assertTrue(arena.get("NVDA").isPresent());
        assertTrue(arena.get("AAPL").isEmpty());
        assertTrue(arena.get("MSFT").isEmpty());
    }

    @Test
    @DisplayName("A filtered duplicate does not displace the admitted pivot for the same symbol")
    void filterRunsBeforeDuplicateResolution() {
        EngineProperties.Scanner scanner = new EngineProperties.Scanner();
        scanner.setMinRiskReward(2.0);
        PivotLevel kept = PivotLevel.builder().symbol("AAPL").pivotPrice(100).sideBias(Side.LONG)
                .score(1.0).riskReward(2.5).build();
        PivotLevel dropped = PivotLevel.builder().symbol("AAPL").pivotPrice(105).sideBias(Side.LONG)
                .score(9.0).riskReward(0.5).build();

        SymbolArena arena = new SymbolArena();
        arena.reset(List.of(kept, dropped), scanner, SymbolArenaTest::context);

        assertEquals(100.0, arena.get("AAPL").orElseThrow().pivot().getPivotPrice());
    }
}
