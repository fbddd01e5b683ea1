package com.kotsin.breakout.session;

import com.kotsin.breakout.position.Position;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of comparing a snapshot with broker holdings at startup.
 */
public record ReconciliationReport(
        List<Position> resumed,
        List<ReconciliationMismatchException> mismatches
) {

    public static ReconciliationReport empty() {
        return new ReconciliationReport(List.of(), List.of());
    }

    public Set<String> haltedSymbols() {
        Set<String> halted = new TreeSet<>();
        mismatches.forEach(m -> halted.add(m.getSymbol()));
        return halted;
    }

    public boolean isClean() {
        return mismatches.isEmpty();
    }
}
