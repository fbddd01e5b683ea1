package com.kotsin.breakout.audit;

import com.kotsin.breakout.position.ClosedTrade;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Archives closed trades to MongoDB. Ids are deterministic, so a replayed save overwrites.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MongoClosedTradeSink implements ClosedTradeSink {

    private final ClosedTradeRepository repository;
    private final MeterRegistry meterRegistry;

    @Override
    public void record(ClosedTrade trade) {
        try {
            repository.save(trade);
            meterRegistry.counter("breakout.trades.closed", "reason", trade.getReason().name()).increment();
            log.debug("closed_trade_archived id={} symbol={}", trade.getId(), trade.getSymbol());
        } catch (Exception e) {
            log.error("Failed to archive closed trade {}: {}", trade.getId(), e.toString(), e);
        }
    }
}
