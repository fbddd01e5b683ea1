package com.kotsin.breakout.feed;

import com.kotsin.breakout.audit.ClosedTradeSink;
import com.kotsin.breakout.audit.RecordingDecisionSink;
import com.kotsin.breakout.broker.PaperBrokerClient;
import com.kotsin.breakout.engine.BreakoutEngine;
import com.kotsin.breakout.engine.BreakoutEngineFactory;
import com.kotsin.breakout.engine.DataException;
import com.kotsin.breakout.model.Bar;
import com.kotsin.breakout.model.MarketTick;
import com.kotsin.breakout.model.OrderFlowSample;
import com.kotsin.breakout.model.PivotLevel;
import com.kotsin.breakout.session.InMemorySessionStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays one session of historical bars through a fresh engine with a paper broker.
 *
 * <p>Bars are ordered by open time, then symbol. Each bar carries the latest order-flow sample
 * for its symbol that falls before the bar ends; older samples in the same bar are dropped and
 * counted. Nothing here reads the wall clock, so a run is a pure function of its inputs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReplayDriver {

    private final BreakoutEngineFactory engineFactory;

    public ReplayResult run(LocalDate sessionDate, List<PivotLevel> pivots, List<Bar> bars,
                            List<OrderFlowSample> samples) {
        PaperBrokerClient broker = new PaperBrokerClient();
        RecordingDecisionSink decisions = new RecordingDecisionSink();
        BreakoutEngine engine = engineFactory.createForReplay(broker, new InMemorySessionStateRepository(), decisions,
                ClosedTradeSink.none());
        broker.setFillListener(engine::onFill);
        engine.startSession(sessionDate, pivots);

        long barSeconds = engine.timing().barIntervalSeconds();
        List<OrderFlowSample> valid = new ArrayList<>();
        int dropped = 0;
        for (OrderFlowSample s : samples) {
            try {
                s.validate();
                valid.add(s);
            } catch (DataException e) {
                dropped++;
                log.warn("replay_sample_rejected err={}", e.getMessage());
            }
        }
        Map<String, Deque<OrderFlowSample>> pendingSamples = groupSamples(valid);

        List<Bar> ordered = new ArrayList<>(bars);
        ordered.sort(Comparator.comparing(Bar::openTime).thenComparing(Bar::symbol));
        for (Bar bar : ordered) {
            OrderFlowSample sample = null;
            Deque<OrderFlowSample> queue = pendingSamples.get(bar.symbol());
            if (queue != null) {
                Instant barEnd = bar.openTime().plusSeconds(barSeconds);
                while (!queue.isEmpty() && queue.peekFirst().time().isBefore(barEnd)) {
                    if (sample != null) {
                        dropped++;
                    }
                    sample = queue.pollFirst();
                }
            }
            broker.onBar(bar);
            engine.onTick(MarketTick.of(bar, sample));
        }

        ReplayResult result = new ReplayResult(
                decisions.records(),
                engine.positionManager().ledger(),
                List.copyOf(engine.positionManager().positions().values()),
                engine.positionManager().dailySummary(),
                engine.getTicksProcessed(),
                engine.getTicksRejected(),
                dropped);
        engine.shutdown();
        log.info("replay_done date={} bars={} decisions={} trades={} net={} rejectedTicks={} droppedSamples={}",
                sessionDate, ordered.size(), result.decisions().size(), result.trades().size(),
                String.format("%.2f", result.summary().netPnl()), result.ticksRejected(), dropped);
        return result;
    }

    private static Map<String, Deque<OrderFlowSample>> groupSamples(List<OrderFlowSample> samples) {
        Map<String, Deque<OrderFlowSample>> bySymbol = new HashMap<>();
        samples.stream()
                .sorted(Comparator.comparing(OrderFlowSample::time))
                .forEach(s -> bySymbol.computeIfAbsent(s.symbol(), k -> new ArrayDeque<>()).addLast(s));
        return bySymbol;
    }
}
