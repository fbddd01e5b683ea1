package com.kotsin.breakout.config;

import com.kotsin.breakout.model.SetupType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;

/**
 * Engine configuration bound from {@code engine.*}. Unknown keys fail the context at load time.
 */
@Data
@ConfigurationProperties(prefix = "engine", ignoreUnknownFields = false)
public class EngineProperties {

    private String sessionZone = "America/New_York";

    // Raw bar granularity and the confirmation candle built from it
    private int barIntervalSeconds = 5;
    private int confirmationIntervalSeconds = 60;

    // One full session of 5-second bars fits in 8192 slots
    private int bufferCapacity = 8192;

    private LocalTime entryWindowStart = LocalTime.of(9, 45);
    private LocalTime entryWindowEnd = LocalTime.of(15, 0);
    private LocalTime flattenTime = LocalTime.of(15, 55);

    private int maxAttemptsPerPivot = 2;

    private Account account = new Account();
    private Broker broker = new Broker();
    private Scanner scanner = new Scanner();
    private Map<SetupType, SetupThresholds> setups = defaultSetups();

    @Data
    public static class Account {
        private double accountSize = 100_000;
        private double riskFraction = 0.01;
        private double maxPositionValue = 20_000;
        private int maxShares = 1000;
        private double positionValueBufferFraction = 0.05;
        private double maxTotalExposure = 100_000;
        private double commissionPerShare = 0.005;
    }

    @Data
    public static class Broker {
        private int maxAttempts = 3;
        private long initialBackoffMillis = 200;
        private long maxBackoffMillis = 2000;
        private double ordersPerSecond = 10.0;
        private long permitTimeoutMillis = 2000;
    }

    /**
     * Admission filter for scanner pivots. Pivots below either floor are not watched.
     */
    @Data
    public static class Scanner {
        private double minScore = 0.0;
        private double minRiskReward = 0.0;
    }

    public ZoneId zone() {
        return ZoneId.of(sessionZone);
    }

    public SetupThresholds thresholds(SetupType type) {
        SetupThresholds t = setups.get(type);
        if (t == null) {
            throw new IllegalStateException("No thresholds configured for setup type " + type);
        }
        return t;
    }

    /**
     * Validates every numeric setting. Called once when the engine is built.
     */
    public void validate() {
        if (barIntervalSeconds <= 0) {
            throw new IllegalStateException("engine.bar-interval-seconds must be > 0");
        }
        if (confirmationIntervalSeconds <= 0) {
            throw new IllegalStateException("engine.confirmation-interval-seconds must be > 0");
        }
        if (bufferCapacity <= 1) {
            throw new IllegalStateException("engine.buffer-capacity must be > 1");
        }
        if (entryWindowStart == null || entryWindowEnd == null || flattenTime == null
                || entryWindowEnd.isBefore(entryWindowStart)) {
            throw new IllegalStateException("engine entry window / flatten time are not consistent");
        }
        if (maxAttemptsPerPivot < 1) {
            throw new IllegalStateException("engine.max-attempts-per-pivot must be >= 1");
        }
        if (account.accountSize <= 0 || account.riskFraction <= 0 || account.riskFraction > 1
                || account.maxPositionValue <= 0 || account.maxShares <= 0
                || account.positionValueBufferFraction < 0 || account.maxTotalExposure <= 0
                || account.commissionPerShare < 0) {
            throw new IllegalStateException("engine.account settings are invalid: " + account);
        }
        if (broker.maxAttempts < 1 || broker.ordersPerSecond <= 0) {
            throw new IllegalStateException("engine.broker settings are invalid: " + broker);
        }
        if (scanner.minScore < 0 || scanner.minRiskReward < 0) {
            throw new IllegalStateException("engine.scanner settings are invalid: " + scanner);
        }
        zone();
        for (SetupType type : SetupType.values()) {
            thresholds(type).validate(type.name());
        }
    }

    private static Map<SetupType, SetupThresholds> defaultSetups() {
        Map<SetupType, SetupThresholds> map = new EnumMap<>(SetupType.class);
        map.put(SetupType.MOMENTUM, SetupThresholds.builder().build());
        map.put(SetupType.PULLBACK, SetupThresholds.builder()
                .momentumConfirmsEntry(false)
                .pullbackDistancePct(0.003)
                .build());
        map.put(SetupType.BOUNCE, SetupThresholds.builder()
                .momentumConfirmsEntry(false)
                .strongVolumeRatio(1.5)
                .sustainedCountThreshold(2)
                .build());
        return map;
    }
}
