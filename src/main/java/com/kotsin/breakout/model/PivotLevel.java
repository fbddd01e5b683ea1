package com.kotsin.breakout.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Scanner output for one symbol, read once per session. The engine never generates its own pivots.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PivotLevel {

    private String symbol;
    private double pivotPrice;
    private Side sideBias;
    private double score;
    private double riskReward;

    // Optional scanner target; entries with too little room left before it are rejected
    private Double targetPrice;

    @Builder.Default
    private SetupType setupType = SetupType.MOMENTUM;

    /**
     * Attempt-counter key. Two decimals, so a re-scanned pivot at the same level counts as the same pivot.
     */
    public String pivotKey() {
        return String.format(Locale.ROOT, "%s_%.2f", symbol, pivotPrice);
    }
}
