package com.kotsin.breakout.risk;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Account-wide open exposure and open risk. The only state shared across symbols; every read
 * and write holds the same lock.
 */
@Slf4j
public class AccountExposureAggregator {

    private final double maxTotalExposure;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Reservation> bySymbol = new HashMap<>();
    private double totalExposure;
    private double totalRisk;

    private record Reservation(double exposure, double risk) {
    }

    public AccountExposureAggregator(double maxTotalExposure) {
        this.maxTotalExposure = maxTotalExposure;
    }

    /**
     * Reserves exposure for a new position. Returns false when the account limit would be
     * exceeded or the symbol already holds a reservation.
     */
    public boolean tryReserve(String symbol, double exposure, double risk) {
        lock.lock();
        try {
            if (bySymbol.containsKey(symbol)) {
                return false;
            }
            if (totalExposure + exposure > maxTotalExposure) {
                log.info("exposure_limit symbol={} requested={} open={} max={}",
                        symbol, exposure, totalExposure, maxTotalExposure);
                return false;
            }
            bySymbol.put(symbol, new Reservation(exposure, risk));
            totalExposure += exposure;
            totalRisk += risk;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the reservation with the exposure actually held, e.g. after a fill at another
     * price or a partial exit.
     */
    public void adjust(String symbol, double exposure, double risk) {
        lock.lock();
        try {
            Reservation old = bySymbol.put(symbol, new Reservation(exposure, risk));
            if (old != null) {
                totalExposure -= old.exposure();
                totalRisk -= old.risk();
            }
            totalExposure += exposure;
            totalRisk += risk;
        } finally {
            lock.unlock();
        }
    }

    public void release(String symbol) {
        lock.lock();
        try {
            Reservation old = bySymbol.remove(symbol);
            if (old != null) {
                totalExposure -= old.exposure();
                totalRisk -= old.risk();
            }
        } finally {
            lock.unlock();
        }
    }

    public double totalExposure() {
        lock.lock();
        try {
            return totalExposure;
        } finally {
            lock.unlock();
        }
    }

    public double totalRisk() {
        lock.lock();
        try {
            return totalRisk;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            bySymbol.clear();
            totalExposure = 0;
            totalRisk = 0;
        } finally {
            lock.unlock();
        }
    }
}
