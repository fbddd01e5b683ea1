package com.kotsin.breakout.engine;

import com.kotsin.breakout.config.EngineProperties;
import com.kotsin.breakout.model.PivotLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-symbol contexts for the current session, keyed by symbol. Rebuilt at every session start.
 */
@Slf4j
public class SymbolArena {

    private final Map<String, SymbolContext> contexts = new ConcurrentHashMap<>();

    /**
     * Replaces all contexts with one per watchlist symbol. Pivots below the scanner floors for
     * score or risk/reward are dropped first. When the scanner emits several pivots for a symbol,
     * the highest score wins.
     */
    public void reset(List<PivotLevel> pivots, EngineProperties.Scanner scanner,
                      Function<PivotLevel, SymbolContext> factory) {
        contexts.clear();
        Map<String, PivotLevel> best = pivots.stream()
                .filter(p -> admits(p, scanner))
                .collect(Collectors.toMap(PivotLevel::getSymbol, Function.identity(),
                        (a, b) -> {
                            log.warn("duplicate_pivot symbol={} kept={} dropped={}", a.getSymbol(),
                                    a.getScore() >= b.getScore() ? a.getPivotPrice() : b.getPivotPrice(),
                                    a.getScore() >= b.getScore() ? b.getPivotPrice() : a.getPivotPrice());
                            return a.getScore() >= b.getScore() ? a : b;
                        }));
        best.values().stream()
                .sorted(Comparator.comparing(PivotLevel::getSymbol))
                .forEach(p -> contexts.put(p.getSymbol(), factory.apply(p)));
    }

    private static boolean admits(PivotLevel pivot, EngineProperties.Scanner scanner) {
        if (pivot.getScore() < scanner.getMinScore()) {
            log.info("pivot_filtered symbol={} reason=score score={} min={}",
                    pivot.getSymbol(), pivot.getScore(), scanner.getMinScore());
            return false;
        }
        if (pivot.getRiskReward() < scanner.getMinRiskReward()) {
            log.info("pivot_filtered symbol={} reason=risk_reward riskReward={} min={}",
                    pivot.getSymbol(), pivot.getRiskReward(), scanner.getMinRiskReward());
            return false;
        }
        return true;
    }

    /**
     * Adds a context for a symbol that is not on the watchlist, e.g. one holding a resumed position.
     */
    public SymbolContext addIfAbsent(PivotLevel pivot, Function<PivotLevel, SymbolContext> factory) {
        return contexts.computeIfAbsent(pivot.getSymbol(), s -> factory.apply(pivot));
    }

    public Optional<SymbolContext> get(String symbol) {
        return Optional.ofNullable(contexts.get(symbol));
    }

    public Collection<SymbolContext> contexts() {
        return contexts.values();
    }

    public int size() {
        return contexts.size();
    }

    public void clear() {
        contexts.clear();
    }
}
