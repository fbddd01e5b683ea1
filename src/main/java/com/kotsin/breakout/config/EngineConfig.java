package com.kotsin.breakout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.kotsin.breakout.audit.KafkaDecisionRecordPublisher;
import com.kotsin.breakout.audit.MongoClosedTradeSink;
import com.kotsin.breakout.broker.BrokerClient;
import com.kotsin.breakout.broker.BrokerGateway;
import com.kotsin.breakout.broker.PaperBrokerClient;
import com.kotsin.breakout.engine.BreakoutEngine;
import com.kotsin.breakout.engine.BreakoutEngineFactory;
import com.kotsin.breakout.session.RedisSessionStateRepository;
import com.kotsin.breakout.session.SessionStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Live engine wiring. A real broker adapter replaces the paper client by declaring its own
 * {@link BrokerClient} bean and publishing fills to the fills topic.
 */
@Configuration
@Slf4j
public class EngineConfig {

    @Bean
    @ConditionalOnMissingBean(BrokerClient.class)
    public BrokerClient paperBrokerClient() {
        log.warn("No broker adapter configured; using the paper broker");
        return new PaperBrokerClient();
    }

    @Bean
    public SessionStateRepository sessionStateRepository(RedisTemplate<String, String> sessionStringRedisTemplate,
                                                         ObjectMapper objectMapper) {
        return new RedisSessionStateRepository(sessionStringRedisTemplate, objectMapper);
    }

    @Bean
    public BreakoutEngine liveEngine(BreakoutEngineFactory factory,
                                     BrokerClient brokerClient,
                                     SessionStateRepository sessionStateRepository,
                                     KafkaDecisionRecordPublisher decisionPublisher,
                                     MongoClosedTradeSink closedTradeSink,
                                     Cache<String, Boolean> processedFillsCache,
                                     EngineProperties properties) {
        BrokerGateway gateway = new BrokerGateway(brokerClient, properties.getBroker());
        BreakoutEngine engine = factory.create(gateway, sessionStateRepository, decisionPublisher, closedTradeSink,
                processedFillsCache);
        if (brokerClient instanceof PaperBrokerClient paper) {
            paper.setFillListener(engine::onFill);
        }
        return engine;
    }
}
