package com.insightplatform.common.signal;

import com.insightplatform.common.exception.EngineException;

/**
 * Tunable thresholds of {@link SignalDetector}.
 *
 * @param minSearches           volume floor for every rule
 * @param spikeDemandDeltaPct   week-over-week growth a spike must exceed
 * @param noResultsAvgThreshold highest average results count that still counts as "no results"
 * @param minCtr                lowest click-through rate for high interest
 * @param maxConversionRate     highest conversion rate for low conversion
 */
public record SignalThresholds(
    int minSearches,
    double spikeDemandDeltaPct,
    double noResultsAvgThreshold,
    double minCtr,
    double maxConversionRate
) {

    public static final String STAGE = "signals";

    public static SignalThresholds defaults() {
        return new SignalThresholds(25, 30.0, 0.0, 0.25, 0.01);
    }

    /**
     * @return this, when every threshold is usable
     * @throws EngineException on a negative floor or a rate outside [0, 1]
     */
    public SignalThresholds validate() {
        if (minSearches < 0) {
            throw new EngineException(STAGE, "minSearches must be >= 0, was " + minSearches);
        }
        if (noResultsAvgThreshold < 0) {
            throw new EngineException(STAGE, "noResultsAvgThreshold must be >= 0, was " + noResultsAvgThreshold);
        }
        requireRate("minCtr", minCtr);
        requireRate("maxConversionRate", maxConversionRate);
        if (Double.isNaN(spikeDemandDeltaPct)) {
            throw new EngineException(STAGE, "spikeDemandDeltaPct must be a number");
        }
        return this;
    }

    private static void requireRate(String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 1) {
            throw new EngineException(STAGE, name + " must be within [0, 1], was " + value);
        }
    }
}
