package com.insightplatform.common.trends;

import com.insightplatform.common.exception.EngineException;

/**
 * Tunables of {@link TrendsAnalyzer}.
 *
 * @param minVolume            total searches a query needs to be analyzed at all
 * @param recentWeeks          window length N of the velocity comparison (last N vs previous N weeks)
 * @param velocityThresholdPct percent change beyond which a query is rising or declining
 * @param emergingMaxWeeks     how recent a first appearance must be for an emerging query
 * @param emergingMinVolume    total searches an emerging query needs
 * @param maxPerType           cap per insight family
 */
public record TrendsConfig(
    int minVolume,
    int recentWeeks,
    double velocityThresholdPct,
    int emergingMaxWeeks,
    int emergingMinVolume,
    int maxPerType
) {

    public static final String STAGE = "trends";

    public static TrendsConfig defaults() {
        return new TrendsConfig(10, 4, 25.0, 6, 5, 5);
    }

    public TrendsConfig withEmergingMinVolume(int volume) {
        return new TrendsConfig(minVolume, recentWeeks, velocityThresholdPct, emergingMaxWeeks, volume, maxPerType);
    }

    /**
     * @throws EngineException when a volume or cap is negative or {@code recentWeeks} is not positive
     */
    public TrendsConfig validate() {
        if (minVolume < 0) {
            throw new EngineException(STAGE, "minVolume must be >= 0, was " + minVolume);
        }
        if (recentWeeks <= 0) {
            throw new EngineException(STAGE, "recentWeeks must be > 0, was " + recentWeeks);
        }
        if (Double.isNaN(velocityThresholdPct) || velocityThresholdPct < 0) {
            throw new EngineException(STAGE, "velocityThresholdPct must be >= 0, was " + velocityThresholdPct);
        }
        if (emergingMaxWeeks < 0) {
            throw new EngineException(STAGE, "emergingMaxWeeks must be >= 0, was " + emergingMaxWeeks);
        }
        if (emergingMinVolume < 0) {
            throw new EngineException(STAGE, "emergingMinVolume must be >= 0, was " + emergingMinVolume);
        }
        if (maxPerType < 0) {
            throw new EngineException(STAGE, "maxPerType must be >= 0, was " + maxPerType);
        }
        return this;
    }
}
