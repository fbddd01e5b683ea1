package com.kotsin.breakout.position;

import com.kotsin.breakout.model.SetupType;
import com.kotsin.breakout.model.Side;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An order the engine submitted and has not seen filled. Keyed by client order id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PendingOrder {

    private String clientOrderId;
    private String symbol;
    private OrderPurpose purpose;
    private Side side;
    private int shares;
    private double referencePrice;
    private Instant submittedAt;

    // entry only
    private double stopPrice;
    private double pivotPrice;
    private String pivotKey;
    private SetupType setupType;
    private long logicalPosition;

    // exits only
    private ExitReason reason;
    private int partialLevel;

    public PendingOrder copy() {
        return toBuilder().build();
    }
}
