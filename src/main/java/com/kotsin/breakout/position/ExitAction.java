package com.kotsin.breakout.position;

import java.util.OptionalDouble;

/**
 * Result of one exit evaluation. A stop adjustment may accompany an exit or stand alone.
 */
public record ExitAction(
        Type type,
        ExitReason reason,
        int partialLevel,
        double fraction,
        OptionalDouble newStop
) {

    public enum Type {
        NONE,
        PARTIAL,
        FULL
    }

    public static ExitAction none(OptionalDouble newStop) {
        return new ExitAction(Type.NONE, null, -1, 0.0, newStop);
    }

    public static ExitAction partial(int level, double fraction) {
        return new ExitAction(Type.PARTIAL, ExitReason.PARTIAL, level, fraction, OptionalDouble.empty());
    }

    public static ExitAction full(ExitReason reason, OptionalDouble newStop) {
        return new ExitAction(Type.FULL, reason, -1, 1.0, newStop);
    }

    public boolean isExit() {
        return type != Type.NONE;
    }
}
