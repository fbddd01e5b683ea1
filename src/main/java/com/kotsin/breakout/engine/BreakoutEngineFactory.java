package com.kotsin.breakout.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kotsin.breakout.audit.ClosedTradeSink;
import com.kotsin.breakout.audit.DecisionRecordSink;
import com.kotsin.breakout.broker.BrokerClient;
import com.kotsin.breakout.broker.BrokerGateway;
import com.kotsin.breakout.broker.PaperBrokerClient;
import com.kotsin.breakout.config.EngineProperties;
import com.kotsin.breakout.position.PositionManager;
import com.kotsin.breakout.risk.AccountExposureAggregator;
import com.kotsin.breakout.risk.RiskSizer;
import com.kotsin.breakout.session.SessionStateRepository;
import com.kotsin.breakout.session.SessionStateStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Assembles engines from a broker, a snapshot repository and the audit sinks. The live engine and
 * every replay run are built here, so they share identical decision wiring.
 */
@Component
@RequiredArgsConstructor
public class BreakoutEngineFactory {

    private static final long FILL_CACHE_MAX_ENTRIES = 100_000;

    private final EngineProperties properties;

    public BreakoutEngine create(BrokerClient client, SessionStateRepository repository,
                                 DecisionRecordSink decisionSink, ClosedTradeSink tradeSink) {
        return create(new BrokerGateway(client, properties.getBroker()), repository, decisionSink, tradeSink,
                newFillCache());
    }

    /**
     * Engine for a replay run. The paper broker fills on bar time, so its gateway is not rate limited.
     */
    public BreakoutEngine createForReplay(PaperBrokerClient broker, SessionStateRepository repository,
                                          DecisionRecordSink decisionSink, ClosedTradeSink tradeSink) {
        return create(BrokerGateway.unthrottled(broker, properties.getBroker()), repository, decisionSink, tradeSink,
                newFillCache());
    }

    public BreakoutEngine create(BrokerGateway gateway, SessionStateRepository repository,
                                 DecisionRecordSink decisionSink, ClosedTradeSink tradeSink,
                                 Cache<String, Boolean> processedFills) {
        AccountExposureAggregator exposure = new AccountExposureAggregator(properties.getAccount().getMaxTotalExposure());
        PositionManager positions = new PositionManager(properties, new RiskSizer(), exposure, gateway,
                processedFills, tradeSink);
        return new BreakoutEngine(properties, positions, new SessionStateStore(repository), gateway, decisionSink);
    }

    public static Cache<String, Boolean> newFillCache() {
        return Caffeine.newBuilder()
                .maximumSize(FILL_CACHE_MAX_ENTRIES)
                .build();
    }

    public EngineProperties properties() {
        return properties;
    }
}
