package com.kotsin.breakout.session;

/**
 * Persisted state and broker holdings disagree for one symbol. The symbol is halted for new
 * entries; other symbols continue.
 */
public class ReconciliationMismatchException extends RuntimeException {

    public enum Kind {
        MISSING_AT_BROKER,
        SIDE_MISMATCH,
        QUANTITY_MISMATCH,
        UNTRACKED_HOLDING
    }

    private final String symbol;
    private final Kind kind;

    public ReconciliationMismatchException(String symbol, Kind kind, String detail) {
        super(symbol + ": " + kind + " (" + detail + ")");
        this.symbol = symbol;
        this.kind = kind;
    }

    public String getSymbol() {
        return symbol;
    }

    public Kind getKind() {
        return kind;
    }
}
