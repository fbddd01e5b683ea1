package com.kotsin.breakout.session;

import com.kotsin.breakout.broker.BrokerHolding;
import com.kotsin.breakout.model.Side;
import com.kotsin.breakout.position.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionStateStoreTest {

    private static final LocalDate SESSION = LocalDate.of(2024, 3, 15);

    private final InMemorySessionStateRepository repository = new InMemorySessionStateRepository();
    private final SessionStateStore store = new SessionStateStore(repository);

    private static Position position(String symbol, Side side, int remaining) {
        return Position.builder().symbol(symbol).side(side).shares(remaining).remainingShares(remaining)
                .entryPrice(100).stopPrice(99).build();
    }

    private static SessionSnapshot snapshot(Position... positions) {
        return SessionSnapshot.builder().sessionDate(SESSION).positions(List.of(positions)).build();
    }

    @Test
    @DisplayName("Positions matching broker side and size resume")
    void cleanResume() {
        ReconciliationReport report = store.reconcile(snapshot(position("AAPL", Side.LONG, 50)),
                List.of(new BrokerHolding("AAPL", Side.LONG, 50, 100.0)));

        assertTrue(report.isClean());
        assertEquals(1, report.resumed().size());
        assertTrue(report.haltedSymbols().isEmpty());
    }

    @Test
    @DisplayName("A persisted position the broker does not hold is a phantom and is not resumed")
    void phantomPosition() {
        ReconciliationReport report = store.reconcile(snapshot(position("AAPL", Side.LONG, 50)), List.of());

        assertTrue(report.resumed().isEmpty());
        assertEquals(ReconciliationMismatchException.Kind.MISSING_AT_BROKER, report.mismatches().get(0).getKind());
        assertEquals(Set.of("AAPL"), report.haltedSymbols());
    }

    @Test
    @DisplayName("Side and quantity disagreements halt only the affected symbols")
    void sideAndQuantityMismatch() {
        ReconciliationReport report = store.reconcile(
                snapshot(position("AAPL", Side.LONG, 50), position("MSFT", Side.SHORT, 30), position("NVDA", Side.LONG, 10)),
                List.of(new BrokerHolding("AAPL", Side.SHORT, 50, 100.0),
                        new BrokerHolding("MSFT", Side.SHORT, 20, 300.0),
                        new BrokerHolding("NVDA", Side.LONG, 10, 800.0)));

        assertEquals(List.of("NVDA"), report.resumed().stream().map(Position::getSymbol).toList());
        assertEquals(List.of(ReconciliationMismatchException.Kind.SIDE_MISMATCH,
                        ReconciliationMismatchException.Kind.QUANTITY_MISMATCH),
                report.mismatches().stream().map(ReconciliationMismatchException::getKind).toList());
    }

    @Test
    @DisplayName("Broker holdings missing from the snapshot are untracked mismatches")
    void untrackedHolding() {
        ReconciliationReport report = store.reconcile(snapshot(),
                List.of(new BrokerHolding("TSLA", Side.LONG, 5, 170.0)));

        assertEquals(ReconciliationMismatchException.Kind.UNTRACKED_HOLDING, report.mismatches().get(0).getKind());
        assertTrue(report.resumed().isEmpty());
    }

    @Test
    @DisplayName("Snapshots are written from the bound source and failures are counted, not thrown")
    void snapshotWritesAndCountsFailures() {
        store.snapshot();
        assertEquals(0, repository.getSaveCount());

        store.bind(() -> snapshot(position("AAPL", Side.LONG, 50)));
        store.snapshot();
        assertEquals(1, repository.getSaveCount());
        assertEquals(1, store.load(SESSION).orElseThrow().getPositions().size());

        SessionStateStore failing = new SessionStateStore(new SessionStateRepository() {
            @Override
            public void save(SessionSnapshot snapshot) {
                throw new IllegalStateException("redis down");
            }

            @Override
            public Optional<SessionSnapshot> load(LocalDate sessionDate) {
                throw new IllegalStateException("redis down");
            }
        });
        failing.bind(() -> snapshot());
        assertDoesNotThrow(failing::snapshot);
        assertEquals(1, failing.getFailedWrites());
        assertTrue(failing.load(SESSION).isEmpty());
    }
}
