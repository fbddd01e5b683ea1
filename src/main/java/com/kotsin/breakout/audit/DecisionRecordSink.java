package com.kotsin.breakout.audit;

/**
 * Destination for decision records. Must not throw back into the engine.
 */
@FunctionalInterface
public interface DecisionRecordSink {

    void publish(DecisionRecord record);
}
