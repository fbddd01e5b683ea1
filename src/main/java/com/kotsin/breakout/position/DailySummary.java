package com.kotsin.breakout.position;

import java.time.LocalDate;
import java.util.List;

/**
 * Session roll-up of the closed-trade ledger.
 */
public record DailySummary(
        LocalDate sessionDate,
        int trades,
        int winners,
        int losers,
        double grossPnl,
        double fees,
        double netPnl
) {

    public static DailySummary of(LocalDate sessionDate, List<ClosedTrade> ledger) {
        int winners = 0;
        int losers = 0;
        double gross = 0;
        double fees = 0;
        double net = 0;
        for (ClosedTrade t : ledger) {
            if (t.getRealizedPnl() > 0) {
                winners++;
            } else if (t.getRealizedPnl() < 0) {
                losers++;
            }
            gross += t.getGrossPnl();
            fees += t.getFees();
            net += t.getRealizedPnl();
        }
        return new DailySummary(sessionDate, ledger.size(), winners, losers, gross, fees, net);
    }

    public double winRate() {
        return trades == 0 ? 0.0 : (double) winners / trades;
    }
}
