package com.barlang.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Configuration for a simulation run
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestConfig(
    @JsonProperty("initialCapital") double initialCapital
) {
    public static final double DEFAULT_INITIAL_CAPITAL = 100_000.0;

    public BacktestConfig {
        if (!(initialCapital > 0) || Double.isInfinite(initialCapital)) {
            throw new IllegalArgumentException("initialCapital must be a positive number, got " + initialCapital);
        }
    }

    /**
     * Create default config
     */
    public static BacktestConfig defaults() {
        return new BacktestConfig(DEFAULT_INITIAL_CAPITAL);
    }
}
