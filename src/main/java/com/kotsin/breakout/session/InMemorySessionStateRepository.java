package com.kotsin.breakout.session;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps snapshots in memory. Used by replay runs and tests.
 */
public class InMemorySessionStateRepository implements SessionStateRepository {

    private final Map<LocalDate, SessionSnapshot> snapshots = new ConcurrentHashMap<>();
    private int saveCount;

    @Override
    public synchronized void save(SessionSnapshot snapshot) {
        snapshots.put(snapshot.getSessionDate(), snapshot);
        saveCount++;
    }

    @Override
    public Optional<SessionSnapshot> load(LocalDate sessionDate) {
        return Optional.ofNullable(snapshots.get(sessionDate));
    }

    public synchronized int getSaveCount() {
        return saveCount;
    }
}
