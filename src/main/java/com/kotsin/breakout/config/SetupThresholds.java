package com.kotsin.breakout.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Named, typed thresholds for one setup type. Percentages are fractions (0.003 = 0.3%)
 * except order-flow imbalance values, which are in percent points like the samples.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SetupThresholds {

    // ---- breakout detection / classification ----
    @Builder.Default
    private double minClearancePct = 0.0005;
    @Builder.Default
    private double strongCandlePct = 0.003;
    @Builder.Default
    private double strongVolumeRatio = 2.0;
    @Builder.Default
    private int volumeLookbackCandles = 20;
    @Builder.Default
    private double pullbackDistancePct = 0.003;
    @Builder.Default
    private int maxBreakoutAgeSeconds = 3000;
    // fraction of price still to go before the scanner target; ignored for pivots without one
    @Builder.Default
    private double minRoomToTargetPct = 0.03;

    // ---- confirmation ----
    @Builder.Default
    private boolean momentumConfirmsEntry = true;
    @Builder.Default
    private double singleSampleThreshold = 20.0;
    @Builder.Default
    private double sustainedThreshold = 10.0;
    @Builder.Default
    private int sustainedCountThreshold = 3;
    @Builder.Default
    private boolean pullbackRetestEntry = true;
    // move past the breakout extreme that counts as a bounce
    @Builder.Default
    private double bounceThresholdPct = 0.0015;

    // ---- stops ----
    @Builder.Default
    private double initialStopOffsetPct = 0.0;
    @Builder.Default
    private double trailActivationPct = 0.005;
    @Builder.Default
    private double trailDistancePct = 0.01;

    // ---- exits ----
    @Builder.Default
    private int stallWindowStartMinutes = 7;
    @Builder.Default
    private int stallWindowEndMinutes = 15;
    @Builder.Default
    private double stallTolerancePct = 0.001;
    @Builder.Default
    private boolean breakevenAfterPartial = true;
    @Builder.Default
    private List<PartialLevel> partials = new ArrayList<>(List.of(
            new PartialLevel(0.0025, 0.5),
            new PartialLevel(0.01, 0.25)));

    /**
     * One profit-taking level: when the favourable move reaches {@code gainPct} of entry,
     * sell {@code fraction} of the original position.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PartialLevel {
        private double gainPct;
        private double fraction;
    }

    /**
     * Fail fast on a threshold set that cannot work.
     */
    public void validate(String name) {
        require(minClearancePct >= 0, name, "min-clearance-pct must be >= 0");
        require(strongCandlePct > 0, name, "strong-candle-pct must be > 0");
        require(strongVolumeRatio > 0, name, "strong-volume-ratio must be > 0");
        require(volumeLookbackCandles > 0, name, "volume-lookback-candles must be > 0");
        require(pullbackDistancePct >= 0, name, "pullback-distance-pct must be >= 0");
        require(maxBreakoutAgeSeconds > 0, name, "max-breakout-age-seconds must be > 0");
        require(minRoomToTargetPct >= 0, name, "min-room-to-target-pct must be >= 0");
        require(bounceThresholdPct >= 0, name, "bounce-threshold-pct must be >= 0");
        require(singleSampleThreshold > 0 && singleSampleThreshold <= 100, name, "single-sample-threshold must be in (0, 100]");
        require(sustainedThreshold > 0 && sustainedThreshold <= 100, name, "sustained-threshold must be in (0, 100]");
        require(sustainedCountThreshold >= 1, name, "sustained-count-threshold must be >= 1");
        require(initialStopOffsetPct >= 0 && initialStopOffsetPct < 0.5, name, "initial-stop-offset-pct must be in [0, 0.5)");
        require(trailActivationPct >= 0, name, "trail-activation-pct must be >= 0");
        require(trailDistancePct > 0 && trailDistancePct < 0.5, name, "trail-distance-pct must be in (0, 0.5)");
        require(stallWindowStartMinutes >= 0 && stallWindowEndMinutes >= stallWindowStartMinutes,
                name, "stall window must satisfy 0 <= start <= end");
        require(stallTolerancePct >= 0, name, "stall-tolerance-pct must be >= 0");

        double total = 0;
        double lastGain = 0;
        for (PartialLevel level : partials) {
            require(level.getFraction() > 0, name, "partial fraction must be > 0");
            require(level.getGainPct() > lastGain, name, "partial gain levels must be strictly increasing");
            lastGain = level.getGainPct();
            total += level.getFraction();
        }
        // a runner must always remain after the configured partials
        require(total < 1.0, name, "partial fractions must sum to < 1");
    }

    private static void require(boolean condition, String name, String message) {
        if (!condition) {
            throw new IllegalStateException("engine.setups." + name + ": " + message);
        }
    }
}
