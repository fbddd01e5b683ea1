package com.kotsin.breakout.audit;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaDecisionRecordPublisherTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private KafkaDecisionRecordPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new KafkaDecisionRecordPublisher(kafkaTemplate, meterRegistry);
        ReflectionTestUtils.setField(publisher, "decisionsTopic", "breakout.decisions");
    }

    private static DecisionRecord record(String action, String reason) {
        return new DecisionRecord("AAPL", Instant.parse("2024-03-15T14:00:00Z"), 12, action, reason, "LONG",
                100.4, null, "IDLE", null, Map.of("pivot", 100.0));
    }

    @Test
    @DisplayName("Records are keyed by symbol on the decisions topic and counted by action and reason")
    void publishesAndCounts() {
        DecisionRecord reject = record("REJECT", "price_reversal");
        publisher.publish(reject);
        publisher.publish(reject);
        publisher.publish(record("ENTER", null));

        verify(kafkaTemplate, times(2)).send("breakout.decisions", "AAPL", reject);
        assertEquals(2.0, meterRegistry.get("breakout.decisions")
                .tag("action", "REJECT").tag("reason", "price_reversal").counter().count());
        assertEquals(1.0, meterRegistry.get("breakout.decisions")
                .tag("action", "ENTER").tag("reason", "none").counter().count());
    }

    @Test
    @DisplayName("A failing send is logged and never reaches the engine")
    void sendFailureContained() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("broker down"));
        assertDoesNotThrow(() -> publisher.publish(record("WAIT", null)));
    }
}
