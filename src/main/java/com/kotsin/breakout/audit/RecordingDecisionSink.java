package com.kotsin.breakout.audit;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects records in arrival order. Used by replay so a run returns its full decision trail.
 */
public class RecordingDecisionSink implements DecisionRecordSink {

    private final List<DecisionRecord> records = new ArrayList<>();

    @Override
    public synchronized void publish(DecisionRecord record) {
        records.add(record);
    }

    public synchronized List<DecisionRecord> records() {
        return List.copyOf(records);
    }
}
