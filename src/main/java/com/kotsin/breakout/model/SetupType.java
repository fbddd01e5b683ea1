package com.kotsin.breakout.model;

/**
 * Setup families. Each carries its own named thresholds in configuration.
 */
public enum SetupType {
    MOMENTUM,
    PULLBACK,
    BOUNCE
}
