package com.kotsin.breakout.position;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.breakout.model.SetupType;
import com.kotsin.breakout.model.Side;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Open position, at most one per symbol.
 *
 * <p>{@code shares} is the original size; {@code remainingShares} shrinks with each partial.
 * The stop only ever moves in the risk-reducing direction.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {

    private String symbol;
    private Side side;
    private SetupType setupType;
    private String pivotKey;
    private double pivotPrice;

    private double entryPrice;
    private Instant entryTime;
    private long entryLogicalPosition;
    private String entryOrderId;

    private int shares;
    private int remainingShares;

    private double stopPrice;
    private double initialStopPrice;
    private String stopOrderId;
    private boolean trailing;

    private double highestPrice;
    private double lowestPrice;

    @Builder.Default
    private List<PartialExit> partialsTaken = new ArrayList<>();
    // index of the next configured partial level to check
    private int nextPartialLevel;

    @Builder.Default
    private List<String> brokerOrderIds = new ArrayList<>();

    private double realizedPnl;
    private double fees;

    @Builder.Default
    private PositionStatus status = PositionStatus.OPEN;

    public double getRemainingFraction() {
        return shares == 0 ? 0.0 : (double) remainingShares / shares;
    }

    @JsonIgnore
    public boolean hasPartials() {
        return !partialsTaken.isEmpty();
    }

    /**
     * Favourable move from entry as a fraction of entry.
     */
    public double gainPct(double price) {
        return side.favourableMove(entryPrice, price) / entryPrice;
    }

    public double unrealizedPnl(double price) {
        return side.favourableMove(entryPrice, price) * remainingShares;
    }

    /**
     * Tightens the stop. Returns false, leaving the stop unchanged, when {@code candidate}
     * would loosen it.
     */
    public boolean tightenStop(double candidate) {
        if (!side.isTighterStop(candidate, stopPrice)) {
            return false;
        }
        stopPrice = candidate;
        return true;
    }

    /**
     * Independent copy, lists included, safe to hand to another thread.
     */
    public Position copy() {
        return toBuilder()
                .partialsTaken(new ArrayList<>(partialsTaken))
                .brokerOrderIds(new ArrayList<>(brokerOrderIds))
                .build();
    }

    public void observePrice(double price) {
        highestPrice = Math.max(highestPrice, price);
        lowestPrice = Math.min(lowestPrice, price);
    }
}
