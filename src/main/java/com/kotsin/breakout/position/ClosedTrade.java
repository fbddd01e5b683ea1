package com.kotsin.breakout.position;

import com.kotsin.breakout.model.SetupType;
import com.kotsin.breakout.model.Side;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger entry for a fully closed position. Archived to the {@code closed_trades} collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "closed_trades")
public class ClosedTrade {

    @Id
    private String id;
    private LocalDate sessionDate;

    private String symbol;
    private Side side;
    private SetupType setupType;
    private double pivotPrice;

    private double entryPrice;
    private Instant entryTime;
    private double exitPrice;
    private Instant exitTime;
    private int shares;

    @Builder.Default
    private List<PartialExit> partials = new ArrayList<>();

    private double grossPnl;
    private double fees;
    // net of fees
    private double realizedPnl;

    private ExitReason reason;
    private long durationSeconds;
    // closed by a broker-side stop the engine did not request
    private boolean external;

    public boolean isWinner() {
        return realizedPnl > 0;
    }
}
