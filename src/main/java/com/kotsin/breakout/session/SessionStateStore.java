package com.kotsin.breakout.session;

import com.kotsin.breakout.broker.BrokerHolding;
import com.kotsin.breakout.position.Position;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Writes a snapshot after every position mutation and reconciles persisted state with the
 * broker at startup.
 *
 * <p>A failed write is logged and counted; trading continues and the next mutation writes again.
 */
@Slf4j
public class SessionStateStore {

    private final SessionStateRepository repository;
    private volatile Supplier<SessionSnapshot> source;
    private long failedWrites;

    public SessionStateStore(SessionStateRepository repository) {
        this.repository = repository;
    }

    /**
     * Sets where snapshots are read from. Called once by the engine that owns the state.
     */
    public void bind(Supplier<SessionSnapshot> source) {
        this.source = source;
    }

    /**
     * Captures the bound state and writes it.
     */
    public synchronized void snapshot() {
        if (source == null) {
            return;
        }
        SessionSnapshot snapshot = source.get();
        if (snapshot.getSessionDate() == null) {
            return;
        }
        try {
            repository.save(snapshot);
            log.debug("session_snapshot_saved date={} positions={} pending={}", snapshot.getSessionDate(),
                    snapshot.getPositions().size(), snapshot.getPendingOrders().size());
        } catch (RuntimeException e) {
            failedWrites++;
            log.error("session_snapshot_failed date={} failures={} err={}", snapshot.getSessionDate(),
                    failedWrites, e.toString());
        }
    }

    /**
     * Final write on shutdown.
     */
    public void flush() {
        snapshot();
        log.info("session_snapshot_flushed failures={}", getFailedWrites());
    }

    public Optional<SessionSnapshot> load(LocalDate sessionDate) {
        try {
            return repository.load(sessionDate);
        } catch (RuntimeException e) {
            log.error("session_snapshot_load_failed date={} err={}", sessionDate, e.toString());
            return Optional.empty();
        }
    }

    /**
     * Compares every persisted position with the broker's holdings. A position resumes only when
     * the broker shows the same side and share count; everything else becomes a mismatch and its
     * symbol is halted. Broker holdings the snapshot does not know about are mismatches too.
     */
    public ReconciliationReport reconcile(SessionSnapshot snapshot, List<BrokerHolding> holdings) {
        Map<String, BrokerHolding> bySymbol = new HashMap<>();
        for (BrokerHolding h : holdings) {
            bySymbol.put(h.symbol(), h);
        }
        List<Position> resumed = new ArrayList<>();
        List<ReconciliationMismatchException> mismatches = new ArrayList<>();
        Set<String> tracked = new HashSet<>();

        for (Position p : snapshot.getPositions()) {
            tracked.add(p.getSymbol());
            BrokerHolding h = bySymbol.get(p.getSymbol());
            if (h == null) {
                mismatches.add(new ReconciliationMismatchException(p.getSymbol(),
                        ReconciliationMismatchException.Kind.MISSING_AT_BROKER,
                        "persisted " + p.getSide() + " " + p.getRemainingShares() + ", broker has none"));
            } else if (h.side() != p.getSide()) {
                mismatches.add(new ReconciliationMismatchException(p.getSymbol(),
                        ReconciliationMismatchException.Kind.SIDE_MISMATCH,
                        "persisted " + p.getSide() + ", broker " + h.side()));
            } else if (h.shares() != p.getRemainingShares()) {
                mismatches.add(new ReconciliationMismatchException(p.getSymbol(),
                        ReconciliationMismatchException.Kind.QUANTITY_MISMATCH,
                        "persisted " + p.getRemainingShares() + ", broker " + h.shares()));
            } else {
                resumed.add(p);
            }
        }
        for (BrokerHolding h : holdings) {
            if (!tracked.contains(h.symbol())) {
                mismatches.add(new ReconciliationMismatchException(h.symbol(),
                        ReconciliationMismatchException.Kind.UNTRACKED_HOLDING,
                        "broker " + h.side() + " " + h.shares() + " not in snapshot"));
            }
        }
        mismatches.forEach(m -> log.error("reconciliation_mismatch symbol={} kind={} detail={}",
                m.getSymbol(), m.getKind(), m.getMessage()));
        log.info("reconciliation_done date={} resumed={} mismatches={}", snapshot.getSessionDate(),
                resumed.size(), mismatches.size());
        return new ReconciliationReport(resumed, mismatches);
    }

    public synchronized long getFailedWrites() {
        return failedWrites;
    }
}
