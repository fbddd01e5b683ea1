package com.kotsin.breakout.session;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Durable home for session snapshots, one per session date.
 */
public interface SessionStateRepository {

    void save(SessionSnapshot snapshot);

    Optional<SessionSnapshot> load(LocalDate sessionDate);
}
