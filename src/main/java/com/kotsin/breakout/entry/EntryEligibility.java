package com.kotsin.breakout.entry;

import java.util.Optional;

/**
 * Point-in-time gates for a new entry on one symbol, assembled by the engine per tick.
 */
public record EntryEligibility(
        boolean entriesEnabled,
        boolean symbolHalted,
        boolean pendingClose,
        boolean positionOpen,
        boolean inEntryWindow,
        int attemptsUsed,
        int maxAttempts
) {

    public static EntryEligibility open(int maxAttempts) {
        return new EntryEligibility(true, false, false, false, true, 0, maxAttempts);
    }

    /**
     * First gate that blocks an entry, checked in a fixed order.
     */
    public Optional<RejectReason> firstBlock() {
        if (!entriesEnabled) {
            return Optional.of(RejectReason.ENTRIES_DISABLED);
        }
        if (symbolHalted) {
            return Optional.of(RejectReason.SYMBOL_HALTED);
        }
        if (pendingClose) {
            return Optional.of(RejectReason.PENDING_CLOSE);
        }
        if (positionOpen) {
            return Optional.of(RejectReason.POSITION_OPEN);
        }
        if (!inEntryWindow) {
            return Optional.of(RejectReason.OUTSIDE_ENTRY_WINDOW);
        }
        if (attemptsUsed >= maxAttempts) {
            return Optional.of(RejectReason.ATTEMPT_CAP_EXHAUSTED);
        }
        return Optional.empty();
    }

    public boolean isEligible() {
        return firstBlock().isEmpty();
    }
}
