package com.kotsin.breakout.audit;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Publishes decision records to Kafka and counts them per action and reason.
 */
@Service
@Slf4j
public class KafkaDecisionRecordPublisher implements DecisionRecordSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    @Value("${kafka.topics.decisions:breakout.decisions}")
    private String decisionsTopic;

    public KafkaDecisionRecordPublisher(KafkaTemplate<String, Object> kafkaTemplate, MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void publish(DecisionRecord record) {
        count(record);
        try {
            kafkaTemplate.send(decisionsTopic, record.symbol(), record);
            log.info("decision_published topic={} symbol={} action={} reason={} path={} price={} shares={}",
                    decisionsTopic, record.symbol(), record.action(), record.reason(), record.path(),
                    record.referencePrice(), record.shares());
        } catch (Exception e) {
            log.error("Failed to publish DecisionRecord for {}: {}", record.symbol(), e.toString(), e);
        }
    }

    private void count(DecisionRecord record) {
        String reason = record.reason() != null ? record.reason() : "none";
        String key = record.action() + "|" + reason;
        counters.computeIfAbsent(key, k -> Counter.builder("breakout.decisions")
                        .description("Evaluated entry attempts")
                        .tag("action", record.action())
                        .tag("reason", reason)
                        .register(meterRegistry))
                .increment();
    }
}
