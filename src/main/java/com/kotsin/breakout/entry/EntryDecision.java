package com.kotsin.breakout.entry;

import com.kotsin.breakout.model.Side;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one evaluation. {@code signals} holds the values that contributed, for the audit trail.
 */
public record EntryDecision(
        EntryAction action,
        RejectReason reason,
        Side side,
        double referencePrice,
        ConfirmationPath path,
        EntryState stateAfter,
        boolean transition,
        Map<String, Object> signals
) {

    public EntryDecision {
        signals = signals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(signals));
    }

    public static EntryDecision idle(Side side, double price) {
        return new EntryDecision(EntryAction.WAIT, null, side, price, null, EntryState.IDLE, false, Map.of());
    }

    public static EntryDecision waiting(Side side, double price, EntryState stateAfter, boolean transition,
                                        Map<String, Object> signals) {
        return new EntryDecision(EntryAction.WAIT, null, side, price, null, stateAfter, transition, signals);
    }

    public static EntryDecision reject(RejectReason reason, Side side, double price, Map<String, Object> signals) {
        return new EntryDecision(EntryAction.REJECT, reason, side, price, null, EntryState.IDLE, true, signals);
    }

    public static EntryDecision enter(Side side, double price, ConfirmationPath path, Map<String, Object> signals) {
        return new EntryDecision(EntryAction.ENTER, null, side, price, path, EntryState.IDLE, true, signals);
    }

    /**
     * Same decision turned into an engine-side rejection (sizing, exposure, broker).
     */
    public EntryDecision rejectedAs(RejectReason engineReason) {
        return new EntryDecision(EntryAction.REJECT, engineReason, side, referencePrice, path, stateAfter, true, signals);
    }

    public boolean isEnter() {
        return action == EntryAction.ENTER;
    }

    /**
     * True when the decision is worth recording: anything other than a quiet idle wait.
     */
    public boolean isNotable() {
        return action != EntryAction.WAIT || transition;
    }
}
